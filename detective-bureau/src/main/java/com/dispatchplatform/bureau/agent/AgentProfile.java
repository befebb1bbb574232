package com.dispatchplatform.bureau.agent;

/**
 * Static identity of one bureau agent.
 *
 * @param id           routing id, e.g. {@code CHASE}
 * @param systemPrompt persona sent with every request the agent makes
 */
public record AgentProfile(String id, String name, String role, String icon, String systemPrompt) {}
