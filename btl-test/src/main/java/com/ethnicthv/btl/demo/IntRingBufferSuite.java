package com.ethnicthv.btl.demo;

import com.ethnicthv.btl.core.suite.TestSuite;
import com.ethnicthv.btl.core.suite.annotation.DescribeClass;

@DescribeClass(IntRingBuffer.class)
public final class IntRingBufferSuite extends TestSuite<IntRingBuffer> {

    public IntRingBufferSuite() {
        super(IntRingBuffer.class);

        describeTest("push", "the buffer has spare capacity", "append in order", () -> {
            IntRingBuffer buf = new IntRingBuffer(4);
            buf.push(1);
            buf.push(2);
            buf.push(3);
            assertAreEqual(buf.size(), 3);
            assertArraysAreEqual(buf.toArray(), new int[]{1, 2, 3}, 0, 3);
        });

        describeTest("push", "the buffer is full", "overwrite the oldest element", () -> {
            IntRingBuffer buf = new IntRingBuffer(3);
            for (int i = 1; i <= 5; i++) buf.push(i);
            assertAreEqual(buf.size(), 3);
            assertArraysAreEqual(buf.toArray(), new int[]{3, 4, 5}, 0, 3);
        });

        describeTest("toArray", "only the newest elements matter", "match on the checked range", () -> {
            IntRingBuffer buf = new IntRingBuffer(3);
            for (int i = 1; i <= 4; i++) buf.push(i * 10);
            // index 0 is deliberately not compared
            assertArraysAreEqual(buf.toArray(), new int[]{-1, 30, 40}, 1, 3);
        });

        describeTest("toArray", "elements are boxed", "compare with equals", () -> {
            IntRingBuffer buf = new IntRingBuffer(2);
            buf.push(7);
            buf.push(8);
            int[] raw = buf.toArray();
            Integer[] boxed = {raw[0], raw[1]};
            assertArraysAreEqual(boxed, new Integer[]{7, 8}, 0, 2);
        });

        describeTest("pop", "the buffer holds elements", "return the oldest first", () -> {
            IntRingBuffer buf = new IntRingBuffer(2);
            buf.push(7);
            buf.push(8);
            assertAreEqual(buf.pop(), 7);
            assertAreEqual(buf.size(), 1);
        });

        describeTest("pop", "the buffer is empty", "throw IllegalStateException", () -> {
            IntRingBuffer buf = new IntRingBuffer(2);
            boolean threw = false;
            try {
                buf.pop();
            } catch (IllegalStateException expected) {
                threw = true;
            }
            assertIsTrue(threw);
            assertIsTrue(buf.isEmpty());
        });
    }
}
