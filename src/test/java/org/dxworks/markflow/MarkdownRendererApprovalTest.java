package org.dxworks.markflow;

import org.approvaltests.Approvals;
import org.junit.jupiter.api.Test;

import java.io.IOException;

public class MarkdownRendererApprovalTest {

    @Test
    void render_HeadingAndParagraph() throws IOException {
        verify("# Title\n\nSome *text*\n");
    }

    @Test
    void render_TaskList() throws IOException {
        verify("- [x] done\n");
    }

    private static void verify(String markdown) throws IOException {
        RenderedDocument document = new MarkdownRenderer(TestUtils.CONFIG).render(markdown);
        Approvals.verify(TestUtils.toApprovalJson(document));
    }
}
