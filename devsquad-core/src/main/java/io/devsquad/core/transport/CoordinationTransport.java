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

package io.devsquad.core.transport;

import io.devsquad.core.model.AgentIdentity;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * Connection of one agent to the coordination server: an inbound line stream and an outbound request channel
 */
public interface CoordinationTransport extends AutoCloseable {

    /**
     * Opens the event stream for the agent.
     *
     * @param identity Agent connecting
     * @return Lazy stream of raw lines, empty if the stream could not be opened. Closing the returned stream
     * closes the underlying connection.
     */
    Optional<Stream<String>> openStream(final AgentIdentity identity);

    /**
     * Sends one request body to the server's message endpoint. Never retried.
     *
     * @param payload JSON body
     * @return true if the server accepted the request
     */
    boolean deliver(final String payload);

    @Override
    void close();
}
