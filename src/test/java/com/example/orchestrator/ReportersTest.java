package com.example.orchestrator;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ReportersTest {

    @Test
    void failingReporterDoesNotBlockOthers() {
        List<String> received = new ArrayList<>();
        Reporter failing = new Reporter() {
            @Override
            public void onTestRemoved(String trigger) {
                throw new IllegalStateException("broken reporter");
            }
        };
        Reporter recording = new Reporter() {
            @Override
            public void onTestRemoved(String trigger) {
                received.add(trigger);
            }
        };

        Reporters reporters = new Reporters(List.of(failing, recording));
        reporters.onTestRemoved("a.test.ts");

        assertEquals(List.of("a.test.ts"), received);
    }

    @Test
    void addedReportersReceiveLaterEvents() {
        List<String> received = new ArrayList<>();
        Reporters reporters = new Reporters(List.of());
        reporters.onTestRemoved("before");
        reporters.add(new Reporter() {
            @Override
            public void onTestRemoved(String trigger) {
                received.add(trigger);
            }
        });
        reporters.onTestRemoved("after");

        assertEquals(List.of("after"), received);
        assertEquals(1, reporters.all().size());
    }
}
