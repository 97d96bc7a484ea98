// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.symbolic;

/// Operator spacing used by [Renderer]. Set the default via system property
/// `io.github.simbo1905.symbolic.RenderStyle`. The default is SPACED.
public enum RenderStyle {
  /// `x * y + 1`
  SPACED(" "),

  /// `x*y+1`
  COMPACT("");

  final String padding;

  RenderStyle(String padding) {
    this.padding = padding;
  }

  String infix(String symbol) {
    return padding + symbol + padding;
  }
}
