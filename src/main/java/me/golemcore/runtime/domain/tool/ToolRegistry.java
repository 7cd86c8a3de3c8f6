package me.golemcore.runtime.domain.tool;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.component.ToolComponent;
import me.golemcore.runtime.domain.model.InputSchema;
import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.domain.model.ValidatedArgs;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Named set of tools available to sessions, in registration order.
 *
 * <p>
 * Writes replace an immutable snapshot under a lock; reads use the current
 * snapshot without locking, so resolution and validation are safe from any
 * number of concurrent sessions.
 */
@Slf4j
public class ToolRegistry {

    private volatile Map<String, ToolComponent> tools = Map.of();

    /**
     * Registers a tool component.
     *
     * @throws DuplicateToolException
     *             if the name is already taken
     */
    public synchronized void register(ToolComponent tool) {
        Objects.requireNonNull(tool, "tool must not be null");
        String name = tool.getToolName();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("tool name must not be blank");
        }
        if (tools.containsKey(name)) {
            throw new DuplicateToolException(name);
        }
        Map<String, ToolComponent> next = new LinkedHashMap<>(tools);
        next.put(name, tool);
        tools = Collections.unmodifiableMap(next);
        log.debug("[Tools] Registered tool: {} [{}]", name, tool.getDefinition().getRiskClass().wireName());
    }

    /**
     * Registers a pure function tool.
     */
    public void register(String name, InputSchema schema, ToolExecutor executor) {
        register(ToolDefinition.builder()
                .name(name)
                .description(name)
                .inputSchema(schema != null ? schema : InputSchema.empty())
                .build(), executor);
    }

    /**
     * Registers a function tool with a full definition (risk class, policy
     * hints).
     */
    public void register(ToolDefinition definition, ToolExecutor executor) {
        register(new FunctionTool(definition, executor));
    }

    /**
     * @throws UnknownToolException
     *             if no tool with this name is registered
     */
    public ToolComponent resolve(String name) {
        ToolComponent tool = name != null ? tools.get(name) : null;
        if (tool == null) {
            throw new UnknownToolException(name);
        }
        return tool;
    }

    public boolean contains(String name) {
        return name != null && tools.containsKey(name);
    }

    /**
     * Tool definitions in registration order.
     */
    public List<ToolDefinition> catalog() {
        List<ToolDefinition> definitions = new ArrayList<>();
        for (ToolComponent tool : tools.values()) {
            definitions.add(tool.getDefinition());
        }
        return Collections.unmodifiableList(definitions);
    }

    public List<String> names() {
        return List.copyOf(tools.keySet());
    }

    /**
     * Checks raw arguments against the tool's input schema. Required fields must
     * be present and non-null; present fields must have the declared type.
     * Arguments the schema does not declare are dropped.
     *
     * @throws SchemaValidationException
     *             listing every violation found
     */
    public ValidatedArgs validate(ToolDefinition tool, Map<String, Object> rawArgs) {
        Map<String, Object> raw = rawArgs != null ? rawArgs : Map.of();
        List<String> violations = new ArrayList<>();
        Map<String, Object> accepted = new LinkedHashMap<>();

        for (InputSchema.Field field : tool.getInputSchema().getFields()) {
            Object value = raw.get(field.name());
            if (value == null) {
                if (field.required()) {
                    violations.add("missing required argument '" + field.name() + "'");
                }
                continue;
            }
            Object coerced = coerce(field.type(), value);
            if (coerced == null) {
                violations.add("argument '" + field.name() + "' must be " + field.type().wireName()
                        + ", got " + jsonTypeOf(value));
                continue;
            }
            accepted.put(field.name(), coerced);
        }

        if (!violations.isEmpty()) {
            throw new SchemaValidationException(tool.getName(), violations);
        }
        for (String key : raw.keySet()) {
            if (tool.getInputSchema().field(key).isEmpty()) {
                log.debug("[Tools] Dropping undeclared argument '{}' for tool {}", key, tool.getName());
            }
        }
        return ValidatedArgs.of(accepted);
    }

    /**
     * Returns the value converted to the declared type, or null on mismatch.
     */
    private static Object coerce(InputSchema.FieldType type, Object value) {
        switch (type) {
        case STRING:
            return value instanceof String ? value : null;
        case BOOLEAN:
            return value instanceof Boolean ? value : null;
        case NUMBER:
            return value instanceof Number ? value : null;
        case INTEGER:
            if (value instanceof Integer || value instanceof Long || value instanceof Short
                    || value instanceof Byte) {
                return ((Number) value).longValue();
            }
            if (value instanceof BigInteger big) {
                return big.bitLength() < Long.SIZE ? big.longValue() : null;
            }
            if (value instanceof BigDecimal decimal) {
                try {
                    return decimal.longValueExact();
                } catch (ArithmeticException e) {
                    return null;
                }
            }
            if (value instanceof Number number) {
                double d = number.doubleValue();
                // [-2^63, 2^63) is exactly the range a long can hold
                if (d == Math.rint(d) && d >= -0x1p63 && d < 0x1p63) {
                    return (long) d;
                }
            }
            return null;
        case OBJECT:
            return value instanceof Map ? value : null;
        case ARRAY:
            return value instanceof List ? value : null;
        default:
            return null;
        }
    }

    private static String jsonTypeOf(Object value) {
        if (value instanceof String) {
            return "string";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof Map) {
            return "object";
        }
        if (value instanceof List) {
            return "array";
        }
        return value.getClass().getSimpleName();
    }
}
