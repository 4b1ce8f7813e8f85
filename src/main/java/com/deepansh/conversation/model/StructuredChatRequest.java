package com.deepansh.conversation.model;

import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class StructuredChatRequest extends ChatRequest {

    /** JSON Schema as an object or a JSON string; implies format json_schema. */
    private Object schema;

    /** "json" or "json_schema". */
    private String format;
}
