/*
 * Copyright 2025 The IRBridge Authors
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

package org.irbridge.integrity;

/** Options that determine how an {@link IntegrityVisitor} walks, reports, and repairs. */
public record IntegrityControl(
    DumpPointers dumpPointers, RepairReporting repairReporting, VisitMode visitMode) {

  /** Whether diagnostics include node ids and instruction identities. */
  public enum DumpPointers {
    DUMP_POINTERS,
    NO_DUMP_POINTERS
  }

  /**
   * Whether sharing that could be repaired by cloning is reported as an error (and so causes the
   * check to fail) or silently recorded for repair.
   */
  public enum RepairReporting {
    REPORT_REPAIRABLE_SHARING,
    DONT_REPORT_REPAIRABLE_SHARING
  }

  /**
   * INCREMENTAL checks only the edges from the examined node to its children, and defers any
   * repairs; BATCH walks the whole subtree and performs repairs.
   */
  public enum VisitMode {
    INCREMENTAL,
    BATCH
  }

  /** The options used when checking each node as it is built. */
  public static IntegrityControl incremental() {
    return new IntegrityControl(
        DumpPointers.DUMP_POINTERS,
        RepairReporting.DONT_REPORT_REPAIRABLE_SHARING,
        VisitMode.INCREMENTAL);
  }

  /** The options used when checking a completed function body. */
  public static IntegrityControl batch() {
    return new IntegrityControl(
        DumpPointers.NO_DUMP_POINTERS,
        RepairReporting.DONT_REPORT_REPAIRABLE_SHARING,
        VisitMode.BATCH);
  }

  public IntegrityControl withRepairReporting(RepairReporting repairReporting) {
    return new IntegrityControl(dumpPointers, repairReporting, visitMode);
  }

  public IntegrityControl withDumpPointers(DumpPointers dumpPointers) {
    return new IntegrityControl(dumpPointers, repairReporting, visitMode);
  }
}
