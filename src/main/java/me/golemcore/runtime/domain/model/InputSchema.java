package me.golemcore.runtime.domain.model;

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

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Declared input of a tool: an ordered list of typed fields. Only structure is
 * described here (names, types, required flags); business rules belong to the
 * policy gate.
 */
@Value
@Builder
public class InputSchema {

    @Singular
    List<Field> fields;

    public static InputSchema empty() {
        return InputSchema.builder().build();
    }

    public Optional<Field> field(String name) {
        return fields.stream().filter(f -> f.name().equals(name)).findFirst();
    }

    /**
     * Renders the schema as a JSON Schema object, the format most model
     * providers expect for function definitions.
     */
    public Map<String, Object> toJsonSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();
        for (Field field : fields) {
            Map<String, Object> property = new LinkedHashMap<>();
            property.put("type", field.type().wireName());
            if (field.description() != null) {
                property.put("description", field.description());
            }
            properties.put(field.name(), property);
            if (field.required()) {
                required.add(field.name());
            }
        }
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", required);
        return schema;
    }

    /**
     * Compact signature, e.g. {@code path: string, append?: boolean}.
     */
    public String signature() {
        List<String> parts = new ArrayList<>();
        for (Field field : fields) {
            parts.add(field.name() + (field.required() ? "" : "?") + ": " + field.type().wireName());
        }
        return String.join(", ", parts);
    }

    public static Field required(String name, FieldType type, String description) {
        return new Field(name, type, true, description);
    }

    public static Field optional(String name, FieldType type, String description) {
        return new Field(name, type, false, description);
    }

    public record Field(String name, FieldType type, boolean required, String description) {
    }

    public enum FieldType {

        STRING("string"), INTEGER("integer"), NUMBER("number"), BOOLEAN("boolean"), OBJECT("object"), ARRAY("array");

        private final String wireName;

        FieldType(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String wireName() {
            return wireName;
        }
    }
}
