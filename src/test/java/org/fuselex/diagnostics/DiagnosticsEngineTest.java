package org.fuselex.diagnostics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

@Tag("unit")
class DiagnosticsEngineTest {

    @Test
    void startsEmpty() {
        DiagnosticsEngine engine = new DiagnosticsEngine();

        assertThat(engine.hasWarnings()).isFalse();
        assertThat(engine.getDiagnostics()).isEmpty();
        assertThat(engine.summary()).isEmpty();
    }

    @Test
    void recordsWarningsWithTheirPosition() {
        DiagnosticsEngine engine = new DiagnosticsEngine("main.fuse");

        engine.reportWarning("Unrecognized input '`' in state 'base'", 4, 1, 5);

        assertThat(engine.hasWarnings()).isTrue();
        assertThat(engine.getDiagnostics())
                .extracting(Diagnostic::sourceName, Diagnostic::offset, Diagnostic::line, Diagnostic::column)
                .containsExactly(tuple("main.fuse", 4, 1, 5));
    }

    @Test
    void summaryListsDiagnosticsInReportOrder() {
        DiagnosticsEngine engine = new DiagnosticsEngine();
        engine.reportWarning("first", 0, 1, 1);
        engine.reportWarning("second", 10, 2, 3);

        assertThat(engine.summary()).isEqualTo(
                "[WARNING] <memory>:1:1: first\n[WARNING] <memory>:2:3: second");
    }

    @Test
    void diagnosticsAreReadOnly() {
        DiagnosticsEngine engine = new DiagnosticsEngine();
        engine.reportWarning("w", 0, 1, 1);

        assertThatThrownBy(() -> engine.getDiagnostics().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
