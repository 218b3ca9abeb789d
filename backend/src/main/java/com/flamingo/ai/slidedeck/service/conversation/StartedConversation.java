package com.flamingo.ai.slidedeck.service.conversation;

import java.util.UUID;

/**
 * A newly started guided conversation.
 *
 * @param sessionId id of the new session
 * @param greeting first assistant turn, taken from the template
 */
public record StartedConversation(UUID sessionId, String greeting) {}
