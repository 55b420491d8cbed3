/*
 * Copyright (C) 2011-2025 Frederic Langlet
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * You may obtain a copy of the License at
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.flanglet.ordo.app;

import io.github.flanglet.ordo.Event;
import io.github.flanglet.ordo.Listener;
import java.io.PrintStream;

/**
 * The {@code InfoPrinter} class implements the {@code Listener} interface. It
 * counts the ranges and partitions reported by an engine and prints them
 * according to the verbosity level.
 */
public class InfoPrinter implements Listener {

    private final PrintStream ps;
    private final int level;
    private long ranges;
    private long partitions;
    private long startTime;

    /**
     * Constructs an {@code InfoPrinter} with the specified information level and
     * output stream.
     *
     * @param infoLevel
     *            the level of information to be printed (events are printed at 5,
     *            summaries at 4 and above)
     * @param ps
     *            the {@code PrintStream} to which information will be printed
     */
    public InfoPrinter(int infoLevel, PrintStream ps) {
        if (ps == null)
            throw new NullPointerException("Invalid null print stream parameter");

        this.ps = ps;
        this.level = infoLevel;
    }

    @Override
    public void processEvent(Event evt) {
        if (this.level >= 5)
            this.ps.println(evt);

        switch (evt.getType()) {
            case SORT_START:
                this.ranges = 0;
                this.partitions = 0;
                this.startTime = evt.getTime();
                break;

            case RANGE:
                this.ranges++;
                break;

            case PARTITION:
                this.partitions++;
                break;

            case SORT_END:
                if (this.level >= 4) {
                    final long durationUs = (evt.getTime() - this.startTime) / 1000L;
                    this.ps.println(String.format("Keys: %d, ranges: %d, partitions: %d [%d us]",
                            evt.getHigh() - evt.getLow() + 1, this.ranges, this.partitions, durationUs));
                }
                break;

            default:
                break;
        }
    }

    /**
     * @return the number of ranges reported since the last start event
     */
    public long getRanges() {
        return this.ranges;
    }

    /**
     * @return the number of partitions reported since the last start event
     */
    public long getPartitions() {
        return this.partitions;
    }
}
