package com.witty.domain.formalize.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Map;

/**
 * @param claimModalities claim identifier → modal operator, for modal claims only
 * @param opaqueTokens    MODAL subtrees that appear as opaque literals in the CNF
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ModalMetadata(Map<String, ModalTag> claimModalities, List<String> opaqueTokens) {}
