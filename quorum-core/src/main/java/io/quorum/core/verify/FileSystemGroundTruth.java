package io.quorum.core.verify;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/// Checks presence, absence and content of files under a root directory.
///
/// Targets are resolved relative to the root. Targets that escape the root are
/// never read and always fail the check. `MODIFIED` is not supported here; pair
/// this with a version-control ground truth through {@link CompositeGroundTruth}.
public class FileSystemGroundTruth implements GroundTruth {

    private final Path root;

    public FileSystemGroundTruth(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public boolean supports(ExpectedSignal.Kind kind) {
        return kind != ExpectedSignal.Kind.MODIFIED;
    }

    @Override
    public GroundTruthCheck check(String targetResource, ExpectedSignal signal) throws IOException {
        Path target = root.resolve(targetResource).normalize();
        if (!target.startsWith(root)) {
            return GroundTruthCheck.unsatisfied(targetResource + " is outside " + root);
        }

        boolean exists = Files.exists(target);
        switch (signal.kind()) {
            case PRESENT:
                return exists
                        ? GroundTruthCheck.satisfied(targetResource + " exists")
                        : GroundTruthCheck.unsatisfied(targetResource + " does not exist");
            case ABSENT:
                return exists
                        ? GroundTruthCheck.unsatisfied(targetResource + " still exists")
                        : GroundTruthCheck.satisfied(targetResource + " is absent");
            case CONTENT_MATCHES:
                if (!Files.isRegularFile(target)) {
                    return GroundTruthCheck.unsatisfied(targetResource + " is not a readable file");
                }
                String content = Files.readString(target, StandardCharsets.UTF_8);
                return Pattern.compile(signal.pattern(), Pattern.MULTILINE).matcher(content).find()
                        ? GroundTruthCheck.satisfied(
                                targetResource + " matches /" + signal.pattern() + "/")
                        : GroundTruthCheck.unsatisfied(
                                targetResource + " does not match /" + signal.pattern() + "/");
            default:
                throw new IllegalArgumentException(
                        "Unsupported signal for file system checks: " + signal.asText());
        }
    }
}
