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

/**
 * Tracks which producer currently holds the floor and the next entry of that producer
 * the consumer should run.
 *
 * <ul>
 *   <li><strong>idle:</strong> no producer; the next appended entry claims the floor</li>
 *   <li><strong>positioned:</strong> a producer and one of its queued entries</li>
 *   <li><strong>exhausted:</strong> a producer but no position; the consumer caught up
 *       with that producer and waits for it to append more</li>
 * </ul>
 *
 * <p>Guarded by the {@link EntryScheduler} lock.</p>
 */
final class ActiveGroupCursor {

    private ProducerHandle producer;
    private Entry position;

    void claim(ProducerHandle newProducer, Entry start) {
        this.producer = newProducer;
        this.position = start;
    }

    void moveTo(Entry next) {
        this.position = next;
    }

    void goIdle() {
        this.producer = null;
        this.position = null;
    }

    boolean isIdle() {
        return producer == null;
    }

    boolean isExhausted() {
        return producer != null && position == null;
    }

    boolean isHeldBy(ProducerHandle candidate) {
        return producer != null && producer == candidate;
    }

    ProducerHandle producer() {
        return producer;
    }

    Entry position() {
        return position;
    }

    @Override
    public String toString() {
        if (producer == null) {
            return "idle";
        }
        return producer.getName() + (position == null ? " (exhausted)" : " @ " + position);
    }
}
