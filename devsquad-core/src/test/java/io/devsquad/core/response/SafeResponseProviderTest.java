/*
 * Copyright (c) 2025 DevSquad Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.devsquad.core.response;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Tests {@link SafeResponseProvider} and {@link TopicFallbackResponseProvider}
 */
class SafeResponseProviderTest {
    private final TopicFallbackResponseProvider fallback = new TopicFallbackResponseProvider(Map.of(
            ResponseTopic.AUTH, "auth answer",
            ResponseTopic.CART, "cart answer",
            ResponseTopic.DEFAULT, "default answer"));

    @Test
    void testDelegateAnswerIsReturned() {
        final var provider = new SafeResponseProvider((prompt, context) -> "from model", fallback);
        assertEquals("from model", provider.getResponse("login page", "ctx"));
    }

    @Test
    void testFailureUsesFallback() {
        final var delegate = mock(ResponseProvider.class);
        when(delegate.getResponse(anyString(), anyString())).thenThrow(new IllegalStateException("boom"));
        final var provider = new SafeResponseProvider(delegate, fallback);
        assertEquals("auth answer", provider.getResponse("Create user Authentication with JWT", "ctx"));
        assertEquals("cart answer", provider.getResponse("shopping cart checkout", "ctx"));
        assertEquals("default answer", provider.getResponse("something else", "ctx"));
        verify(delegate, times(3)).getResponse(anyString(), anyString());
    }

    @Test
    void testNullBecomesEmpty() {
        final var provider = new SafeResponseProvider((prompt, context) -> null, fallback);
        assertEquals("", provider.getResponse("anything", "ctx"));
    }

    @Test
    void testFailingFallbackGivesEmpty() {
        final var provider = new SafeResponseProvider(
                (prompt, context) -> {
                    throw new IllegalStateException("model down");
                },
                (prompt, context) -> {
                    throw new IllegalStateException("fallback down");
                });
        assertEquals("", provider.getResponse("anything", "ctx"));
    }

    @Test
    void testTopicClassification() {
        assertEquals(ResponseTopic.AUTH, ResponseTopic.classify("Implement LOGIN"));
        assertEquals(ResponseTopic.CATALOG, ResponseTopic.classify("Build product catalog with search"));
        assertEquals(ResponseTopic.CART, ResponseTopic.classify("Implement shopping cart"));
        assertEquals(ResponseTopic.DEFAULT, ResponseTopic.classify("Deploy to production"));
        assertEquals(ResponseTopic.DEFAULT, ResponseTopic.classify(null));
    }

    @Test
    void testDefaultAnswerRequired() {
        final var answers = Map.of(ResponseTopic.AUTH, "auth");
        assertThrows(IllegalArgumentException.class, () -> new TopicFallbackResponseProvider(answers));
    }
}
