package com.deepansh.conversation.model;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.List;
import java.util.Map;

@Data
@EqualsAndHashCode(callSuper = true)
public class ToolChatRequest extends ChatRequest {

    /** Tool definitions: {name, description, parameters}. */
    private List<Map<String, Object>> tools;
}
