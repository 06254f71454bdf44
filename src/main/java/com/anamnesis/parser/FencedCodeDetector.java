package com.anamnesis.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.anamnesis.model.Artifact;
import com.anamnesis.model.ArtifactType;
import com.anamnesis.model.LifecycleState;
import com.anamnesis.model.Message;

public class FencedCodeDetector {
    private static final Pattern FENCE = Pattern.compile("```([A-Za-z0-9_+#.-]*)[^\\n]*\\n(.*?)```", Pattern.DOTALL);

    public List<Artifact> detect(Message message) {
        List<Artifact> artifacts = new ArrayList<>();
        Matcher matcher = FENCE.matcher(message.content());
        int ordinal = 0;
        while (matcher.find()) {
            ordinal++;
            String language = matcher.group(1);
            String body = matcher.group(2);
            if (body.endsWith("\n")) {
                body = body.substring(0, body.length() - 1);
            }
            artifacts.add(new Artifact(
                    syntheticId(message.id(), ordinal),
                    null,
                    ArtifactType.code(language.isEmpty() ? "unknown" : language),
                    body,
                    message.id(),
                    List.of(),
                    LifecycleState.CREATED,
                    List.of()));
        }
        return artifacts;
    }

    static String syntheticId(String messageId, int ordinal) {
        return "artifact-" + messageId + "-" + ordinal;
    }
}
