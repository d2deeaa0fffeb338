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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

import org.junit.Test;
import org.marc4j.marc.MarcFactory;
import org.marc4j.marc.Record;

public class ListRecordResultTest {

  private final Record record = MarcFactory.newInstance().newRecord();

  @Test
  public void testFactories() {
    final ListRecordResult active = ListRecordResult.active("MZK01", "000000001", record);
    assertEquals(RecordStatus.ACTIVE, active.getStatus());
    assertSame(record, active.getRecord());
    assertEquals("MZK01", active.getBase());
    assertEquals("000000001", active.getSystemNumber());

    assertNull(ListRecordResult.deleted("MZK01", "000000002").getRecord());
    assertEquals(RecordStatus.FAILED, ListRecordResult.failed("MZK01", "000000003").getStatus());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testActiveNeedsRecord() {
    new ListRecordResult("MZK01", "000000001", RecordStatus.ACTIVE, null);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDeletedHasNoRecord() {
    new ListRecordResult("MZK01", "000000001", RecordStatus.DELETED, record);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testFailedHasNoRecord() {
    new ListRecordResult("MZK01", "000000001", RecordStatus.FAILED, record);
  }

  @Test(expected = NullPointerException.class)
  public void testSystemNumberRequired() {
    ListRecordResult.deleted("MZK01", null);
  }

}
