/*
 * Copyright DataStax, Inc.
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

package io.nosqlbench.serialog;

import io.nosqlbench.serialog.render.RenderAction;

/**
 * One queued unit of deferred work tied to the producer that appended it. The producer
 * and action never change; the links are owned by {@link EntryQueue}.
 */
final class Entry {

    private final ProducerHandle producer;
    private final RenderAction action;

    Entry prev;
    Entry next;
    boolean linked;

    Entry(ProducerHandle producer, RenderAction action) {
        this.producer = producer;
        this.action = action;
    }

    ProducerHandle producer() {
        return producer;
    }

    RenderAction action() {
        return action;
    }

    boolean belongsTo(ProducerHandle candidate) {
        return producer == candidate;
    }

    @Override
    public String toString() {
        return producer.getName() + ":" + action;
    }
}
