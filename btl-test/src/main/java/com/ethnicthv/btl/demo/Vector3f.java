package com.ethnicthv.btl.demo;

import java.util.Objects;

/**
 * Small mutable 3-component float vector used as a demo subject.
 */
public class Vector3f {
    public float x;
    public float y;
    public float z;

    public Vector3f() {}

    public Vector3f(float x, float y, float z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    public Vector3f add(Vector3f other) {
        return new Vector3f(x + other.x, y + other.y, z + other.z);
    }

    public Vector3f scale(float factor) {
        return new Vector3f(x * factor, y * factor, z * factor);
    }

    public float dot(Vector3f other) {
        return x * other.x + y * other.y + z * other.z;
    }

    public float length() {
        return (float) Math.sqrt(dot(this));
    }

    /**
     * Unit vector in the same direction; the zero vector stays zero.
     */
    public Vector3f normalize() {
        float len = length();
        if (len == 0f) return new Vector3f();
        return scale(1f / len);
    }

    public float[] toArray() {
        return new float[]{x, y, z};
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Vector3f v)) return false;
        return Float.compare(x, v.x) == 0 && Float.compare(y, v.y) == 0 && Float.compare(z, v.z) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, z);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ", " + z + ")";
    }
}
