package com.repstack.model.dto.ai;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.Map;

/**
 * Function the model may call. inputSchema is a JSON schema object.
 */
@Data
@AllArgsConstructor
public class ToolSpec {

    private String name;

    private String description;

    private Map<String, Object> inputSchema;
}
