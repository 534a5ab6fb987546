package com.llmcouncil.presentation.dto;

import com.llmcouncil.domain.CouncilOverrides;
import com.llmcouncil.domain.CouncilSnapshot;

/**
 * Council configuration of one conversation: what it overrides and what a turn would use.
 */
public record CouncilConfigResponse(CouncilOverrides overrides, CouncilSnapshot effective) {
}
