package io.minicron.core.exec;

import static org.assertj.core.api.Assertions.assertThat;

import io.minicron.core.log.RunStatus;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ShellCommandExecutorTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldCaptureStdoutAndStderrSeparately() throws Exception {
        ShellCommandExecutor executor = new ShellCommandExecutor(tempDir, 4096);

        ExecutionResult result = executor.run("echo out; echo err 1>&2", Duration.ofSeconds(10));

        assertThat(result.status()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(result.exitCode()).isZero();
        assertThat(result.stdout()).isEqualTo("out\n");
        assertThat(result.stderr()).isEqualTo("err\n");
    }

    @Test
    void shouldEncodeNonZeroExitAsFailure() throws Exception {
        ShellCommandExecutor executor = new ShellCommandExecutor(tempDir, 4096);

        ExecutionResult result = executor.run("exit 3", Duration.ofSeconds(10));

        assertThat(result.status()).isEqualTo(RunStatus.FAILED);
        assertThat(result.exitCode()).isEqualTo(3);
    }

    @Test
    void shouldRunInWorkingDirectory() throws Exception {
        Files.writeString(tempDir.resolve("marker.txt"), "here");
        ShellCommandExecutor executor = new ShellCommandExecutor(tempDir, 4096);

        ExecutionResult result = executor.run("cat marker.txt", Duration.ofSeconds(10));

        assertThat(result.stdout()).isEqualTo("here");
    }

    @Test
    void shouldKillCommandAfterTimeout() throws Exception {
        ShellCommandExecutor executor = new ShellCommandExecutor(tempDir, 4096);

        long started = System.nanoTime();
        ExecutionResult result = executor.run("echo begin; sleep 30; echo end", Duration.ofMillis(300));
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

        assertThat(result.status()).isEqualTo(RunStatus.TIMED_OUT);
        assertThat(result.exitCode()).isNull();
        assertThat(result.stdout()).startsWith("begin").doesNotContain("end");
        assertThat(elapsed).isLessThan(Duration.ofSeconds(10));
    }

    @Test
    void shouldNotRunRemainingCommandsAfterTimeout() throws Exception {
        ShellCommandExecutor executor = new ShellCommandExecutor(tempDir, 4096);

        ExecutionResult result = executor.run("sleep 30; touch after.txt", Duration.ofMillis(200));
        Thread.sleep(500);

        assertThat(result.status()).isEqualTo(RunStatus.TIMED_OUT);
        assertThat(tempDir.resolve("after.txt")).doesNotExist();
    }

    @Test
    void shouldTruncateLargeOutputWithMarker() throws Exception {
        ShellCommandExecutor executor = new ShellCommandExecutor(tempDir, 100);

        ExecutionResult result = executor.run("i=0; while [ $i -lt 1000 ]; do echo line-$i; i=$((i+1)); done", Duration.ofSeconds(10));

        assertThat(result.status()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(result.stdout()).endsWith(OutputCapture.TRUNCATED_MARKER);
        assertThat(result.stdout()).hasSize(100 + OutputCapture.TRUNCATED_MARKER.length());
        assertThat(result.stdout()).startsWith("line-0\n");
    }
}
