package org.dxworks.markflow;

import org.commonmark.Extension;
import org.commonmark.ext.front.matter.YamlFrontMatterExtension;
import org.commonmark.ext.gfm.strikethrough.StrikethroughExtension;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.ext.task.list.items.TaskListItemsExtension;
import org.commonmark.node.Node;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.html.HtmlRenderer;
import org.dxworks.markflow.hir.Hir;
import org.dxworks.markflow.hir.TreeBuilder;
import org.dxworks.markflow.interpreter.FlowInterpreter;
import org.dxworks.markflow.model.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Markdown in, layout elements out: commonmark renders the html, which is
 * tokenized into a tree and interpreted.
 */
public class MarkdownRenderer {
    private static final Logger logger = LoggerFactory.getLogger(MarkdownRenderer.class);

    private final MarkflowConfig config;
    private final Parser parser;
    private final HtmlRenderer htmlRenderer;

    public MarkdownRenderer(MarkflowConfig config) {
        this.config = config;
        List<Extension> extensions = List.of(
                TablesExtension.create(),
                StrikethroughExtension.create(),
                TaskListItemsExtension.create(),
                YamlFrontMatterExtension.create()
        );
        this.parser = Parser.builder()
                .extensions(extensions)
                .build();
        this.htmlRenderer = HtmlRenderer.builder()
                .extensions(extensions)
                .build();
    }

    public String toHtml(String markdown) {
        Node document = parser.parse(markdown);
        return htmlRenderer.render(document);
    }

    public RenderedDocument render(String markdown) {
        return render(markdown, false);
    }

    public RenderedDocument render(String markdown, boolean parallel) {
        long start = System.nanoTime();
        String html = toHtml(markdown);
        Hir hir = TreeBuilder.fromHtml(html);

        FlowInterpreter interpreter = new FlowInterpreter(config);
        List<Element> elements = parallel ? interpreter.interpretParallel(hir) : interpreter.interpret(hir);

        List<Diagnostic> diagnostics = new ArrayList<>(hir.getDiagnostics());
        diagnostics.addAll(interpreter.getDiagnostics());

        logger.debug("Rendered {} nodes into {} elements in {}ms",
                hir.size(), elements.size(), (System.nanoTime() - start) / 1_000_000);
        return new RenderedDocument(elements, diagnostics);
    }
}
