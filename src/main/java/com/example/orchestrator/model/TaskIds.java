package com.example.orchestrator.model;

public final class TaskIds {
    private TaskIds() {
    }

    public static String generateHash(String value) {
        int hash = 0;
        for (int i = 0; i < value.length(); i++) {
            hash = (hash << 5) - hash + value.charAt(i);
        }
        return Integer.toUnsignedString(hash, 36);
    }
}
