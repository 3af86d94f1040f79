package ai.courseware.archiver.render;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class RenderContextTest {

    @Test
    void derivesImageNamesFromSourcePath() {
        assertThat(RenderContext.imageName("https://cdn.test/img/photo.jpeg?w=100")).isEqualTo("photo.jpeg");
        assertThat(RenderContext.imageName("/storage/modules/77/diagram")).isEqualTo("diagram.png");
        assertThat(RenderContext.imageName("https://cdn.test/")).isEqualTo("image.png");
        assertThat(RenderContext.imageName("")).isEqualTo("image.png");
    }

    @Test
    void recordsEachReferenceOnce() {
        RenderContext context = new RenderContext(RenderConfig.defaults());

        context.image("https://cdn.test/a.png", "");
        context.image("https://cdn.test/a.png", "again");
        context.image("", "blank");

        assertThat(context.imageReferences()).containsExactly("https://cdn.test/a.png");
    }
}
