/*
 * Copyright 2009 The FBJS Authors.
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

package com.fbjs.base;

/**
 * A boolean that may also be unknown. Used for the statically determinable truthiness of an
 * expression.
 */
public enum Tri {
  TRUE,
  FALSE,
  UNKNOWN;

  public static Tri forBoolean(boolean value) {
    return value ? TRUE : FALSE;
  }

  public Tri not() {
    switch (this) {
      case TRUE:
        return FALSE;
      case FALSE:
        return TRUE;
      default:
        return UNKNOWN;
    }
  }

  /** Whether the value is known, in either direction. */
  public boolean isKnown() {
    return this != UNKNOWN;
  }

  /**
   * Converts to a boolean, using {@code defaultValue} when unknown.
   */
  public boolean toBoolean(boolean defaultValue) {
    switch (this) {
      case TRUE:
        return true;
      case FALSE:
        return false;
      default:
        return defaultValue;
    }
  }
}
