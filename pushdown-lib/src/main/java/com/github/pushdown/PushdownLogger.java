// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pushdown;

import java.util.logging.Logger;

/// We are using JUL logging to reduce dependencies. You can configure JUL logging to bridge to your chosen logging
/// framework. All classes in this library log through the one named logger below.
public final class PushdownLogger {
  public static final Logger LOGGER = Logger.getLogger(PushdownLogger.class.getPackageName());

  private PushdownLogger() {
  }
}
