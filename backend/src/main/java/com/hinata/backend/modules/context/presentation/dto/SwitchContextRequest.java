package com.hinata.backend.modules.context.presentation.dto;

/**
 * Both ids optional. A team alone also activates its organization; neither clears the context.
 */
public record SwitchContextRequest(Long organizationId, Long teamId) {
}
