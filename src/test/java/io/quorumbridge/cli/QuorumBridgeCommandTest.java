package io.quorumbridge.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.quorumbridge.testing.TestSigners;
import io.quorumbridge.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

final class QuorumBridgeCommandTest {

    @Test
    void pauseApprovedFromTheCommandLineBlocksBridgeOut() throws Exception {
        Path root = Files.createTempDirectory("quorumbridge-test-cli-");
        try {
            Assertions.assertEquals(0, run(root, "init").exitCode());

            List<String> deploy = new ArrayList<>(List.of("deploy", "--name", "away", "--variant", "burn-mint",
                    "--chain-id", "137", "--admin", TestSigners.administrator().value()));
            for (int i = 0; i < 4; i++) {
                deploy.add("--signer");
                deploy.add(TestSigners.address(i).value());
            }
            Result deployed = run(root, deploy.toArray(new String[0]));
            Assertions.assertEquals(0, deployed.exitCode());
            Assertions.assertEquals("BURN_AND_MINT", deployed.json().path("variant").asText());

            Result requested = run(root, "request", "--deployment", "away",
                    "--caller", TestSigners.address(0).value(), "--type", "pause");
            Assertions.assertEquals(0, requested.exitCode());
            String operationId = requested.json().path("operationId").asText();

            for (int i = 0; i < 3; i++) {
                Result signed = run(root, "sign", "--key", TestSigners.PRIVATE_KEYS.get(i),
                        "--deployment", "away", "--id", operationId);
                Assertions.assertEquals(TestSigners.address(i).value(), signed.json().path("signer").asText());
                Result submitted = run(root, "submit-signature", "--deployment", "away",
                        "--caller", TestSigners.address(i).value(), "--id", operationId,
                        "--signature", signed.json().path("signature").asText());
                Assertions.assertEquals(0, submitted.exitCode());
                Assertions.assertEquals(i + 1, submitted.json().path("signatureCount").asInt());
            }

            Result status = run(root, "status", "--deployment", "away");
            Assertions.assertEquals("PAUSED", status.json().path("lifecycle").asText());

            Result refused = run(root, "bridge-out", "--deployment", "away",
                    "--caller", TestSigners.address(6).value(), "--amount", "1",
                    "--target", TestSigners.address(6).value(), "--chain-id", "137");
            Assertions.assertEquals(QuorumBridgeCommand.EXIT_REJECTED, refused.exitCode());
            Assertions.assertEquals("PAUSED", refused.json().path("rejected").asText());
            Assertions.assertEquals("LIFECYCLE", refused.json().path("category").asText());
            Assertions.assertEquals("Contract is paused", refused.json().path("reason").asText());

            Result verified = run(root, "journal-verify");
            Assertions.assertEquals(0, verified.exitCode());
            Assertions.assertTrue(verified.json().path("ok").asBoolean());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void invalidInputExitsWithOne() throws Exception {
        Path root = Files.createTempDirectory("quorumbridge-test-cli-invalid-");
        try {
            Assertions.assertEquals(1, run(root, "deploy", "--name", "away").exitCode());
            Assertions.assertEquals(1, run(root, "status", "--deployment", "missing").exitCode());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Result run(Path root, String... args) throws IOException {
        String[] full = new String[args.length + 2];
        full[0] = "--root";
        full[1] = root.toString();
        System.arraycopy(args, 0, full, 2, args.length);

        PrintStream original = System.out;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        int exitCode;
        try (PrintStream sink = new PrintStream(captured, true, StandardCharsets.UTF_8)) {
            System.setOut(sink);
            exitCode = QuorumBridgeCommand.commandLine().execute(full);
        } finally {
            System.setOut(original);
        }
        return new Result(exitCode, captured.toString(StandardCharsets.UTF_8));
    }

    private record Result(int exitCode, String output) {
        JsonNode json() throws IOException {
            return Jsons.compact().readTree(output);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
