/*
Copyright 2011-2025 Frederic Langlet
Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
you may obtain a copy of the License at

                http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package io.github.flanglet.ordo;

/**
 * This class represents events emitted by the sorting and selection engines.
 * Each event carries a type, a pair of array indices and a timestamp.
 */
public class Event {

    /**
     * Enum representing the types of events that can occur.
     */
    public enum Type {
        /**
         * Beginning of a sort or a selection, indices delimit the processed range
         */
        SORT_START,

        /**
         * A range is about to be partitioned (one event per non trivial range)
         */
        RANGE,

        /**
         * End of a partition, indices delimit the pivot band
         */
        PARTITION,

        /**
         * End of the heap construction phase of heapsort
         */
        HEAP_BUILT,

        /**
         * End of a sort or a selection
         */
        SORT_END
    }

    private final Type type;
    private final int low;
    private final int high;
    private final long time;

    /**
     * Constructs an Event with the specified type and indices.
     *
     * @param type
     *            the type of event
     * @param low
     *            the first index
     * @param high
     *            the last index (inclusive)
     */
    public Event(Type type, int low, int high) {
        this(type, low, high, 0);
    }

    /**
     * Constructs an Event with the specified type, indices and time.
     *
     * @param type
     *            the type of event
     * @param low
     *            the first index
     * @param high
     *            the last index (inclusive)
     * @param time
     *            the event timestamp, current nano time if not positive
     */
    public Event(Type type, int low, int high, long time) {
        this.type = type;
        this.low = low;
        this.high = high;
        this.time = (time > 0) ? time : System.nanoTime();
    }

    /**
     * Returns the type of the event.
     *
     * @return the event type
     */
    public Type getType() {
        return this.type;
    }

    /**
     * Returns the first index covered by the event.
     *
     * @return the low index
     */
    public int getLow() {
        return this.low;
    }

    /**
     * Returns the last index (inclusive) covered by the event.
     *
     * @return the high index
     */
    public int getHigh() {
        return this.high;
    }

    /**
     * Returns the timestamp of the event.
     *
     * @return the event timestamp
     */
    public long getTime() {
        return this.time;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(100);
        sb.append("{ \"type\":\"").append(this.type).append("\"");
        sb.append(", \"low\":").append(this.low);
        sb.append(", \"high\":").append(this.high);
        sb.append(", \"time\":").append(this.time);
        sb.append(" }");
        return sb.toString();
    }
}
