/*
 *   Copyright aleph-nought Developers Team
 *
 *   Licensed under the Apache License, Version 2.0 (the "License");
 *   you may not use this file except in compliance with the License.
 *   You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *   Unless required by applicable law or agreed to in writing, software
 *   distributed under the License is distributed on an "AS IS" BASIS,
 *   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *   See the License for the specific language governing permissions and
 *   limitations under the License.
 */

package cz.mzk.aleph;

import java.util.Objects;

import org.marc4j.marc.Record;

/**
 * One classified record of an OAI harvest. The MARC record is available if and
 * only if the status is {@link RecordStatus#ACTIVE}.
 */
public final class ListRecordResult {

  private final String base;
  private final String systemNumber;
  private final RecordStatus status;
  private final Record record;

  public ListRecordResult(String base, String systemNumber, RecordStatus status, Record record) {
    this.base = Objects.requireNonNull(base, "base");
    this.systemNumber = Objects.requireNonNull(systemNumber, "systemNumber");
    this.status = Objects.requireNonNull(status, "status");
    if ((status == RecordStatus.ACTIVE) != (record != null)) {
      throw new IllegalArgumentException("A MARC record must be given if and only if status is ACTIVE (status=" + status + ")");
    }
    this.record = record;
  }

  public static ListRecordResult active(String base, String systemNumber, Record record) {
    return new ListRecordResult(base, systemNumber, RecordStatus.ACTIVE, record);
  }

  public static ListRecordResult deleted(String base, String systemNumber) {
    return new ListRecordResult(base, systemNumber, RecordStatus.DELETED, null);
  }

  public static ListRecordResult failed(String base, String systemNumber) {
    return new ListRecordResult(base, systemNumber, RecordStatus.FAILED, null);
  }

  /** The Aleph base (library), e.g. {@code MZK01}. */
  public String getBase() {
    return base;
  }

  /** The Aleph system number (doc number) of the record. */
  public String getSystemNumber() {
    return systemNumber;
  }

  public RecordStatus getStatus() {
    return status;
  }

  /** Returns the parsed MARC record, {@code null} unless {@link RecordStatus#ACTIVE}. */
  public Record getRecord() {
    return record;
  }

  @Override
  public String toString() {
    return "ListRecordResult[base=" + base + " systemNumber=" + systemNumber + " status=" + status + "]";
  }

}
