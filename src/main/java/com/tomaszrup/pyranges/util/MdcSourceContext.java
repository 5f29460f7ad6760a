////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.pyranges.util;

import org.slf4j.MDC;

import java.util.Map;

/**
 * Manages the SLF4J MDC (Mapped Diagnostic Context) key {@code "source"} so
 * that every log line written while a file is processed names that file.
 *
 * <h3>Usage:</h3>
 * <pre>{@code
 * Map<String, String> previous = MdcSourceContext.snapshot();
 * MdcSourceContext.setSource("pkg/module.py");
 * try {
 *     // ... all log calls inside here will include [module.py]
 * } finally {
 *     MdcSourceContext.restore(previous);
 * }
 * }</pre>
 *
 * <p>Use {@link #wrap(Runnable)} to carry the context into another
 * thread.</p>
 */
public final class MdcSourceContext {

    /** MDC key used in the logback pattern via {@code %X{source}}. */
    public static final String MDC_KEY = "source";

    static final String UNKNOWN_SOURCE = "<unknown>";

    private MdcSourceContext() {
        // utility class
    }

    /**
     * Sets the MDC {@code "source"} key to the last path segment of the
     * given file name, or {@code <unknown>} when there is none.
     */
    public static void setSource(String filename) {
        MDC.put(MDC_KEY, label(filename));
    }

    static String label(String filename) {
        if (filename == null || filename.isEmpty()) {
            return UNKNOWN_SOURCE;
        }
        String normalized = filename.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        String name = normalized.substring(slash + 1);
        return name.isEmpty() ? normalized : name;
    }

    /**
     * Removes the MDC {@code "source"} key from the current thread.
     */
    public static void clear() {
        MDC.remove(MDC_KEY);
    }

    /**
     * @return the current MDC context map, or null if empty
     */
    public static Map<String, String> snapshot() {
        return MDC.getCopyOfContextMap();
    }

    /**
     * Restores a previously captured MDC context map on the current thread.
     *
     * @param contextMap the context map to restore (may be null)
     */
    public static void restore(Map<String, String> contextMap) {
        if (contextMap != null) {
            MDC.setContextMap(contextMap);
        } else {
            MDC.clear();
        }
    }

    /**
     * Wraps a {@link Runnable} so that the current thread's MDC context is
     * captured and restored in the executing thread. After the task completes,
     * the executing thread's MDC is restored to its previous state.
     */
    public static Runnable wrap(Runnable task) {
        Map<String, String> callerContext = snapshot();
        return () -> {
            Map<String, String> previousContext = snapshot();
            restore(callerContext);
            try {
                task.run();
            } finally {
                restore(previousContext);
            }
        };
    }
}
