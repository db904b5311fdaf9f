package com.openforge.cortex.llm;

import java.util.List;

/**
 * Recognises GPU / accelerator faults reported by the model server. These are
 * worth one more try on CPU; everything else is not.
 */
public final class AcceleratorFaultClassifier {

    private static final List<String> MARKERS = List.of(
            "Metal",
            "Internal Error",
            "command buffer",
            "status 5",
            "CUDA error");

    private static final int MAX_CAUSE_DEPTH = 16;

    private AcceleratorFaultClassifier() {}

    public static boolean isTransient(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (matches(current.getMessage())) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    static boolean matches(String message) {
        if (message == null) {
            return false;
        }
        for (String marker : MARKERS) {
            if (message.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
