package eu.virtualparadox.labelrecall;

import eu.virtualparadox.labelrecall.classify.model.Prediction;
import eu.virtualparadox.labelrecall.ingest.model.Example;
import eu.virtualparadox.labelrecall.label.LabelPath;
import eu.virtualparadox.labelrecall.query.ClassificationManager;
import eu.virtualparadox.labelrecall.rag.embed.HashingProjectionEncoder;
import eu.virtualparadox.labelrecall.rag.embed.TextEncoder;
import eu.virtualparadox.labelrecall.rag.index.ActiveIndexRegistry;
import eu.virtualparadox.labelrecall.rag.index.ReindexService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "labelrecall.root=${java.io.tmpdir}/label-recall-test",
        "labelrecall.voting.top-k=1",
        "labelrecall.encoder.dimension=32"
})
class LabelRecallApplicationTest {

    @Autowired
    private TextEncoder encoder;

    @Autowired
    private ReindexService reindexService;

    @Autowired
    private ClassificationManager classificationManager;

    @Autowired
    private ActiveIndexRegistry registry;

    @AfterEach
    void tearDown() {
        registry.teardown();
    }

    @Test
    @DisplayName("The context wires the configured hashing encoder without any input files")
    void contextLoads() {
        assertThat(encoder).isInstanceOf(HashingProjectionEncoder.class);
        assertThat(encoder.dimension()).isEqualTo(32);
        assertThat(registry.hasActiveIndex()).isFalse();
    }

    @Test
    @DisplayName("An indexed corpus text is classified with its own label")
    void indexAndClassify() {
        reindexService.reindex(List.of(
                new Example("湖人队夺得总冠军", LabelPath.of("体育", "篮球")),
                new Example("高考改革方案公布", LabelPath.of("教育"))));

        final Prediction prediction = classificationManager.classify("高考改革方案公布");

        assertThat(prediction.labelPath()).isEqualTo(LabelPath.of("教育"));
    }
}
