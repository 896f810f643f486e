package com.storyforge.orchestrator.workflow.nodes;

import com.storyforge.orchestrator.error.JobExecutionException;
import com.storyforge.orchestrator.error.JobExecutionException.Category;
import com.storyforge.orchestrator.generation.GenerationClient;
import com.storyforge.orchestrator.workflow.PortValue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NodeTypesTest {

    @Mock GenerationClient generation;

    // ------------------------------------------------------------------
    // Inputs
    // ------------------------------------------------------------------

    @Test
    void textInput_truncatesToDefaultMaxLength() {
        String longText = "x".repeat(1500);

        Map<String, PortValue> out = new TextInputNode().create(Map.of("text", longText)).execute(Map.of());

        assertThat(out.get("text").value()).hasSize(1000);
        assertThat(out.get("text").kind()).isEqualTo(PortValue.Kind.TEXT);
    }

    @Test
    void textInput_withoutText_emitsEmptyString() {
        Map<String, PortValue> out = new TextInputNode().create(Map.of()).execute(Map.of());

        assertThat(out.get("text").value()).isEmpty();
    }

    @Test
    void textInput_nonNumericMaxLength_isValidationFailure() {
        assertThatThrownBy(() -> new TextInputNode().create(Map.of("text", "a", "max_length", "lots")).execute(Map.of()))
                .isInstanceOf(JobExecutionException.class)
                .satisfies(e -> assertThat(((JobExecutionException) e).getCategory()).isEqualTo(Category.VALIDATION));
    }

    @Test
    void imageInput_prefersUrlOverFile() {
        Map<String, PortValue> out = new ImageInputNode()
                .create(Map.of("image_url", "https://cdn/a.png", "image_file", "/tmp/a.png"))
                .execute(Map.of());

        assertThat(out).containsEntry("image", PortValue.url("https://cdn/a.png"));
    }

    @Test
    void videoInput_fallsBackToFile() {
        Map<String, PortValue> out = new VideoInputNode().create(Map.of("video_file", "/tmp/v.mp4")).execute(Map.of());

        assertThat(out).containsEntry("video", PortValue.file("/tmp/v.mp4"));
    }

    @Test
    void imageInput_withNothingConfigured_isMissingData() {
        assertThatThrownBy(() -> new ImageInputNode().create(Map.of()).execute(Map.of()))
                .isInstanceOf(JobExecutionException.class)
                .hasMessageContaining("image_url")
                .satisfies(e -> assertThat(((JobExecutionException) e).isTransient()).isFalse());
    }

    // ------------------------------------------------------------------
    // Generation
    // ------------------------------------------------------------------

    @Test
    void llmProcess_defaultTemplatePassesTextThrough() {
        when(generation.completeText(eq("llm_process"), eq("raw text"), any())).thenReturn("polished");

        Map<String, PortValue> out = new LlmProcessNode(generation).create(Map.of())
                .execute(Map.of("text", PortValue.text("raw text")));

        assertThat(out.get("text").value()).isEqualTo("polished");
    }

    @Test
    void aiImage_usesConfigPromptAndSize() {
        when(generation.generateImage("a red kite", Map.of("width", 512, "height", 768))).thenReturn("https://cdn/k.png");

        Map<String, PortValue> out = new AiImageNode(generation)
                .create(Map.of("prompt", "a red kite", "width", 512, "height", "768"))
                .execute(Map.of());

        assertThat(out).containsEntry("image", PortValue.url("https://cdn/k.png"));
    }

    @Test
    void aiImage_withoutPrompt_isMissingData() {
        assertThatThrownBy(() -> new AiImageNode(generation).create(Map.of()).execute(Map.of()))
                .isInstanceOf(JobExecutionException.class)
                .satisfies(e -> assertThat(((JobExecutionException) e).getCategory()).isEqualTo(Category.MISSING_DATA));
        verifyNoInteractions(generation);
    }

    @Test
    void aiVideo_withoutImage_isMissingData() {
        assertThatThrownBy(() -> new AiVideoNode(generation).create(Map.of()).execute(Map.of("prompt", PortValue.text("pan"))))
                .isInstanceOf(JobExecutionException.class)
                .hasMessageContaining("image");
        verifyNoInteractions(generation);
    }

    @Test
    void aiVideo_passesDurationAndPrompt() {
        when(generation.generateVideo("https://cdn/a.png", "slow pan", Map.of("duration", 8))).thenReturn("https://cdn/a.mp4");

        Map<String, PortValue> out = new AiVideoNode(generation).create(Map.of("duration", 8))
                .execute(Map.of("image", PortValue.url("https://cdn/a.png"), "prompt", PortValue.text("slow pan")));

        assertThat(out).containsEntry("video", PortValue.url("https://cdn/a.mp4"));
    }
}
