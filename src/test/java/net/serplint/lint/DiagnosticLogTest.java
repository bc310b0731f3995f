// Copyright 2026 The Serplint Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.serplint.lint;

import static com.google.common.truth.Truth.assertThat;

import java.util.Locale;
import net.serplint.syntax.Position;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link DiagnosticLog}. */
@RunWith(JUnit4.class)
public class DiagnosticLogTest {

  private final DiagnosticLog log = new DiagnosticLog("t.se", "def f():\n    return(x)\n\tpass");

  @Test
  public void testRepositionsByLeadingWhitespace() {
    log.log(1, 7, DiagnosticCode.UNDEFINED_VARIABLE, "Undefined variable \"x\"");
    log.logf(Position.of(2, 0), DiagnosticCode.UNUSED_ARGUMENT, "Unused argument \"%s\"", "y");
    assertThat(log.diagnostics())
        .containsExactly(
            Diagnostic.create(
                "t.se", 2, 12, DiagnosticCode.UNDEFINED_VARIABLE, "Undefined variable \"x\""),
            Diagnostic.create(
                "t.se", 3, 2, DiagnosticCode.UNUSED_ARGUMENT, "Unused argument \"y\""))
        .inOrder();
  }

  @Test
  public void testLineOutsideSourceIsNotCorrected() {
    log.log(9, 3, DiagnosticCode.UNREFERENCED_ASSIGNMENT, "m");
    assertThat(log.diagnostics().get(0).toString()).isEqualTo("t.se:10:4 W203 m");
  }

  @Test
  public void testUpstreamPositionsAreKept() {
    log.logUpstream(2, 5, DiagnosticCode.COMPILE_ERROR, "bad");
    assertThat(log.diagnostics().get(0).toString()).isEqualTo("t.se:2:5 E100 bad");
  }

  @Test
  public void testDuplicatesAreDropped() {
    log.log(1, 7, DiagnosticCode.UNDEFINED_VARIABLE, "Undefined variable \"x\"");
    log.log(1, 7, DiagnosticCode.UNDEFINED_VARIABLE, "Undefined variable \"x\"");
    log.logUpstream(2, 12, DiagnosticCode.UNDEFINED_VARIABLE, "Undefined variable \"x\"");
    assertThat(log.diagnostics()).hasSize(1);
  }

  @Test
  public void testOnlyErrorsFailTheRun() {
    log.log(0, 0, DiagnosticCode.UNUSED_ARGUMENT, "Unused argument \"a\"");
    assertThat(log.failed()).isFalse();
    log.log(0, 0, DiagnosticCode.INVALID_KEYWORD_ARGUMENT, "Invalid keyword argument \"k\"");
    assertThat(log.failed()).isTrue();
  }

  @Test
  public void testCodes() {
    assertThat(DiagnosticCode.COMPILE_ERROR.isError()).isTrue();
    assertThat(DiagnosticCode.UNDEFINED_VARIABLE.severity())
        .isEqualTo(DiagnosticCode.Severity.ERROR);
    assertThat(DiagnosticCode.UNREFERENCED_ASSIGNMENT.severity())
        .isEqualTo(DiagnosticCode.Severity.WARNING);
    assertThat(DiagnosticCode.UNUSED_ARGUMENT.toString()).isEqualTo("W202");
  }

  @Test
  public void testSeverityNamesIgnoreDefaultLocale() {
    Locale saved = Locale.getDefault();
    Locale.setDefault(new Locale("tr", "TR"));
    try {
      assertThat(DiagnosticCode.Severity.WARNING.toString()).isEqualTo("warning");
      assertThat(Binding.Kind.ASSIGNMENT.toString()).isEqualTo("assignment");
    } finally {
      Locale.setDefault(saved);
    }
  }
}
