package com.apisurface.signature.cli.validation;

import com.apisurface.signature.cli.exception.OptionsValidationException;
import com.apisurface.signature.cli.model.CheckCompatibilityOptions;
import com.apisurface.signature.cli.model.FormatOptions;
import com.apisurface.signature.cli.model.MergeOptions;
import com.apisurface.signature.cli.model.SubtractOptions;
import com.apisurface.signature.cli.model.UpdateHeaderOptions;
import com.apisurface.signature.cli.model.ValidatedCheckCompatibilityOptions;
import com.apisurface.signature.cli.model.ValidatedFormatOptions;
import com.apisurface.signature.compat.IssueType;
import com.apisurface.signature.compat.Severity;
import com.apisurface.signature.format.FormatVersion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the option validators of every command.
 */
class OptionsValidatorsTest {

    @TempDir
    Path tempDir;

    private Path api;
    private Path released;

    @BeforeEach
    void setUp() throws IOException {
        api = Files.writeString(tempDir.resolve("api.txt"), "// Signature format: 2.0\n");
        released = Files.writeString(tempDir.resolve("released.txt"), "// Signature format: 2.0\n");
    }

    private static <T> T parse(T options, String... args) {
        new CommandLine(options).parseArgs(args);
        return options;
    }

    @Test
    void testValidFormatOptions() {
        FormatOptions options = parse(new FormatOptions(),
                "--input", api.toString(), "--output", tempDir.resolve("out.txt").toString(),
                "--format", "3.0", "--hide-annotation", "test.pkg.Hide");

        ValidatedFormatOptions validated = new FormatOptionsValidator().validate(options);

        assertThat(validated.getFormat().getVersion()).isEqualTo(FormatVersion.V3);
        assertThat(validated.getFilterConfig().getHideAnnotations()).containsExactly("test.pkg.Hide");
    }

    @Test
    void testFormatOptionsCollectEveryError() {
        FormatOptions options = parse(new FormatOptions(),
                "--input", tempDir.resolve("missing.txt").toString(), "--output", tempDir.toString(),
                "--format", "7.0", "--show-annotation", "A", "--hide-annotation", "A");

        assertThatThrownBy(() -> new FormatOptionsValidator().validate(options))
                .isInstanceOf(OptionsValidationException.class)
                .satisfies(e -> assertThat(((OptionsValidationException) e).getErrors()).hasSize(4))
                .hasMessageContaining("does not exist or is not a file")
                .hasMessageContaining("is a directory")
                .hasMessageContaining("Invalid --format '7.0'")
                .hasMessageContaining("Annotation A is both shown and hidden.");
    }

    @Test
    void testMergeWithoutFormatKeepsInputFormat() {
        MergeOptions options = parse(new MergeOptions(),
                "--input", api.toString(), released.toString(), "--output", tempDir.resolve("out.txt").toString());

        ValidatedFormatOptions validated = new MergeOptionsValidator().validate(options);

        assertThat(validated.getFormat()).isNull();
        assertThat(validated.getFilterConfig().isEmpty()).isTrue();
    }

    @Test
    void testSubtractRequiresExistingFiles() {
        SubtractOptions options = parse(new SubtractOptions(),
                "--input", api.toString(), "--subtract", tempDir.resolve("nope.txt").toString(),
                "--output", tempDir.resolve("out.txt").toString());

        assertThatThrownBy(() -> new SubtractOptionsValidator().validate(options))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("--subtract");
    }

    @Test
    void testUpdateHeaderRejectsBadFormat() {
        UpdateHeaderOptions options = parse(new UpdateHeaderOptions(),
                "--input", api.toString(), "--format", "2.0:kotlin-style-nulls=yes");

        assertThatThrownBy(() -> new UpdateHeaderOptionsValidator().validate(options))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("migrating");
    }

    @Test
    void testCheckCompatibilitySeverities() {
        CheckCompatibilityOptions options = parse(new CheckCompatibilityOptions(),
                "--api", api.toString(), "--released", released.toString(),
                "--error", "AddedMethod", "--hide", "RemovedMethod", "--warnings-as-errors");

        ValidatedCheckCompatibilityOptions validated = new CheckCompatibilityOptionsValidator().validate(options);

        assertThat(validated.getIssueConfiguration().severityOf(IssueType.ADDED_METHOD)).isEqualTo(Severity.ERROR);
        assertThat(validated.getIssueConfiguration().severityOf(IssueType.REMOVED_METHOD)).isEqualTo(Severity.HIDDEN);
        assertThat(validated.getIssueConfiguration().isWarningsAsErrors()).isTrue();
        assertThat(validated.getFilterConfig().isEmpty()).isTrue();
    }

    @Test
    void testCheckCompatibilityUnknownRule() {
        CheckCompatibilityOptions options = parse(new CheckCompatibilityOptions(),
                "--api", api.toString(), "--released", released.toString(), "--warning", "NoSuchRule");

        assertThatThrownBy(() -> new CheckCompatibilityOptionsValidator().validate(options))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageStartingWith("Invalid --warning value:");
    }

    @Test
    void testCheckCompatibilityMissingBaseline() {
        CheckCompatibilityOptions options = parse(new CheckCompatibilityOptions(),
                "--api", api.toString(), "--released", released.toString(),
                "--baseline", tempDir.resolve("baseline.txt").toString());

        assertThatThrownBy(() -> new CheckCompatibilityOptionsValidator().validate(options))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("--baseline");
    }
}
