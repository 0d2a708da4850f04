package org.neuralchilli.pressroom.support;

import io.quarkus.test.Mock;
import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.pressroom.domain.WritingRequest;
import org.neuralchilli.pressroom.domain.Article;
import org.neuralchilli.pressroom.stage.ArticleWriter;

@Mock
@ApplicationScoped
public class ScriptedWriter implements ArticleWriter {

    private final Script<WritingRequest, Article> script = new Script<>(request -> Fixtures.article());

    @Override
    public Article write(WritingRequest request) {
        return script.invoke(request);
    }

    public Script<WritingRequest, Article> script() {
        return script;
    }
}
