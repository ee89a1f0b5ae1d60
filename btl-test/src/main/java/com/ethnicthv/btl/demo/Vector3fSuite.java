package com.ethnicthv.btl.demo;

import com.ethnicthv.btl.core.suite.TestSuite;
import com.ethnicthv.btl.core.suite.annotation.DescribeClass;

@DescribeClass(Vector3f.class)
public final class Vector3fSuite extends TestSuite<Vector3f> {

    public Vector3fSuite() {
        super(Vector3f.class);

        describeTest("add", "both vectors are non-zero", "sum each component", () -> {
            Vector3f sum = new Vector3f(1, 2, 3).add(new Vector3f(4, 5, 6));
            assertAreEqual(sum, new Vector3f(5, 7, 9));
        });

        describeTest("scale", "the factor is not exactly representable", "match within float tolerance", () -> {
            Vector3f scaled = new Vector3f(1, 2, 3).scale(0.1f);
            assertAreEqual(scaled.x, 0.1f);
            assertAreEqual(scaled.y, 0.2f);
            assertAreEqual(scaled.z, 0.3f);
        });

        describeTest("dot", "the vectors are perpendicular", "return zero", () -> {
            assertAreEqual(new Vector3f(1, 0, 0).dot(new Vector3f(0, 1, 0)), 0f);
        });

        describeTest("length", "the vector is a 3-4-5 triangle leg", "return five", () -> {
            assertAreEqual(new Vector3f(3, 4, 0).length(), 5f);
        });

        describeTest("normalize", "the vector is non-zero", "return a unit vector in the same direction", () -> {
            Vector3f unit = new Vector3f(3, 4, 0).normalize();
            assertArraysAreEqual(unit.toArray(), new float[]{0.6f, 0.8f, 0f}, 0, 3);
            assertAreEqual(unit.length(), 1f);
        });

        describeTest("normalize", "the vector is zero", "return the zero vector", () -> {
            assertAreEqual(new Vector3f().normalize(), new Vector3f());
        });

        describeTest("equals", "compared with itself or null", "be reflexive and reject null", () -> {
            Vector3f v = new Vector3f(1, 1, 1);
            assertAreSame(v, v);
            assertIsTrue(v.equals(v));
            assertIsFalse(v.equals(null));
        });
    }
}
