package net.batchq.core.model;

/** 값이 클수록 먼저 dequeue 된다. */
public enum TaskPriority {
    LOW(0), NORMAL(1), HIGH(2), URGENT(3);

    private final int value;

    TaskPriority(int value) { this.value = value; }

    public int value() { return value; }

    public static TaskPriority fromValue(int value) {
        for (TaskPriority p : values()) {
            if (p.value == value) return p;
        }
        return NORMAL;
    }
}
