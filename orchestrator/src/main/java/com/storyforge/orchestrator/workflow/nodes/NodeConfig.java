package com.storyforge.orchestrator.workflow.nodes;

import com.storyforge.orchestrator.error.JobExecutionException;
import com.storyforge.orchestrator.error.JobExecutionException.Category;
import com.storyforge.orchestrator.workflow.PortValue;

import java.util.Map;

/** Small helpers for reading node config and inputs. */
final class NodeConfig {

    private NodeConfig() {}

    static String string(Map<String, Object> config, String key) {
        Object v = config.get(key);
        return v == null || v.toString().isBlank() ? null : v.toString();
    }

    static int integer(Map<String, Object> config, String key, int fallback) {
        Object v = config.get(key);
        if (v instanceof Number n) return n.intValue();
        if (v != null) {
            try {
                return Integer.parseInt(v.toString().trim());
            } catch (NumberFormatException e) {
                throw new JobExecutionException(Category.VALIDATION, key + " must be a number, got '" + v + "'");
            }
        }
        return fallback;
    }

    /** Input port value, else the named config entry as text, else null. */
    static String inputOrConfig(Map<String, PortValue> inputs, String port, Map<String, Object> config) {
        PortValue in = inputs.get(port);
        if (in != null && !in.value().isBlank()) return in.value();
        return string(config, port);
    }

    static JobExecutionException missing(String what) {
        return new JobExecutionException(Category.MISSING_DATA, what);
    }
}
