package com.ethnicthv.btl.demo;

/**
 * Fixed-capacity FIFO of ints that overwrites the oldest element when full.
 */
public class IntRingBuffer {
    private final int[] data;
    private int head; // index of the oldest element
    private int size;

    public IntRingBuffer(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        this.data = new int[capacity];
    }

    public void push(int value) {
        int tail = (head + size) % data.length;
        data[tail] = value;
        if (size == data.length) {
            head = (head + 1) % data.length;
        } else {
            size++;
        }
    }

    public int pop() {
        if (size == 0) throw new IllegalStateException("buffer is empty");
        int value = data[head];
        head = (head + 1) % data.length;
        size--;
        return value;
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return data.length;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /** Elements oldest first. */
    public int[] toArray() {
        int[] out = new int[size];
        for (int i = 0; i < size; i++) {
            out[i] = data[(head + i) % data.length];
        }
        return out;
    }
}
