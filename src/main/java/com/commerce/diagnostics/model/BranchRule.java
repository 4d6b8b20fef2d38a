package com.commerce.diagnostics.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One routing rule of a branch node: {@code {"if": <condition>, "next": <node id>}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BranchRule {

    @JsonProperty("if")
    private BranchCondition condition;

    private String next;
}
