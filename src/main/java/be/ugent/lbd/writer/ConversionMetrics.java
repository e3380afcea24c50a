/*
 * 
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *     http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package be.ugent.lbd.writer;

import java.util.Locale;

/**
 * Counters and timings of one conversion run.
 */
public final class ConversionMetrics {

  private final long entitiesProcessed;
  private final long triplesWritten;
  private final double loadSeconds;
  private final double writeSeconds;
  private final double totalSeconds;

  public ConversionMetrics(long entitiesProcessed, long triplesWritten, double writeSeconds) {
    this(entitiesProcessed, triplesWritten, 0, writeSeconds, writeSeconds);
  }

  public ConversionMetrics(long entitiesProcessed, long triplesWritten, double loadSeconds, double writeSeconds,
                  double totalSeconds) {
    this.entitiesProcessed = entitiesProcessed;
    this.triplesWritten = triplesWritten;
    this.loadSeconds = loadSeconds;
    this.writeSeconds = writeSeconds;
    this.totalSeconds = totalSeconds;
  }

  public ConversionMetrics withTimings(double loadSeconds, double totalSeconds) {
    return new ConversionMetrics(entitiesProcessed, triplesWritten, loadSeconds, writeSeconds, totalSeconds);
  }

  public long getEntitiesProcessed() {
    return entitiesProcessed;
  }

  public long getTriplesWritten() {
    return triplesWritten;
  }

  public double getLoadSeconds() {
    return loadSeconds;
  }

  public double getWriteSeconds() {
    return writeSeconds;
  }

  public double getTotalSeconds() {
    return totalSeconds;
  }

  /**
   * @return triples per second of write time, 0 when nothing was timed
   */
  public double getThroughput() {
    return writeSeconds > 0 ? triplesWritten / writeSeconds : 0;
  }

  @Override
  public String toString() {
    return String.format(Locale.ROOT, "entities=%d triples=%d load=%.3fs write=%.3fs total=%.3fs",
                    entitiesProcessed, triplesWritten, loadSeconds, writeSeconds, totalSeconds);
  }
}
