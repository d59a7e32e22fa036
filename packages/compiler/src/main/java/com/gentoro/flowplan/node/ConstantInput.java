package com.gentoro.flowplan.node;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Literal value configured for the input slot at {@code index}.
 *
 * @param constant the literal, JSON null when the slot has no value
 */
public record ConstantInput(JsonNode constant, int index) {}
