package org.neuralchilli.pressroom.support;

import io.quarkus.test.Mock;
import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.pressroom.domain.ExtractRequest;
import org.neuralchilli.pressroom.domain.ExtractedContent;
import org.neuralchilli.pressroom.stage.ContentExtractor;

@Mock
@ApplicationScoped
public class ScriptedExtractor implements ContentExtractor {

    private final Script<ExtractRequest, ExtractedContent> script = new Script<>(request -> Fixtures.content(request.url()));

    @Override
    public ExtractedContent extract(ExtractRequest request) {
        return script.invoke(request);
    }

    public Script<ExtractRequest, ExtractedContent> script() {
        return script;
    }
}
