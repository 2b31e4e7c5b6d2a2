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

package org.irbridge.util;

/** Static-only class with methods for building strings used in dumps and diagnostics. */
public class StringUtil {

  private StringUtil() {}

  /** Appends {@code 2 * depth} spaces to {@code sb}. */
  public static StringBuilder indent(StringBuilder sb, int depth) {
    for (int i = 0; i < depth; i++) {
      sb.append("  ");
    }
    return sb;
  }

  private static final int ID_LENGTH = 4;

  /** Returns a short, arbitrary string useful for identifying this object. */
  public static String id(Object x) {
    if (x == null) {
      return "null";
    }
    String hash = Integer.toHexString(System.identityHashCode(x));
    return hash.substring(Math.max(0, hash.length() - ID_LENGTH));
  }
}
