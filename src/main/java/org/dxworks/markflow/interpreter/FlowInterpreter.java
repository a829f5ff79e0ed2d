package org.dxworks.markflow.interpreter;

import org.dxworks.markflow.Diagnostic;
import org.dxworks.markflow.DiagnosticKind;
import org.dxworks.markflow.MarkflowConfig;
import org.dxworks.markflow.hir.Hir;
import org.dxworks.markflow.hir.HirContent;
import org.dxworks.markflow.hir.HirNode;
import org.dxworks.markflow.html.Attr;
import org.dxworks.markflow.html.HeaderType;
import org.dxworks.markflow.html.TagName;
import org.dxworks.markflow.html.style.FontStyle;
import org.dxworks.markflow.html.style.FontWeight;
import org.dxworks.markflow.html.style.Style;
import org.dxworks.markflow.html.style.StyleParser;
import org.dxworks.markflow.html.style.TextDecoration;
import org.dxworks.markflow.model.ColorFormat;
import org.dxworks.markflow.model.Element;
import org.dxworks.markflow.model.NativeColor;
import org.dxworks.markflow.model.Spacer;
import org.dxworks.markflow.model.Theme;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Walks a {@link Hir} and flattens it into text boxes, spacers and tables.
 * <p>
 * Formatting flows down the tree as an {@link InheritedState}; each branch
 * derives its own copy. Text is collected in the current box of a
 * {@link Flow} until a block boundary pushes it to the output.
 * <p>
 * One interpreter is meant for one document: its {@link Anchorizer} keeps
 * heading slugs unique across everything it has interpreted.
 */
public class FlowInterpreter {
    private static final Logger logger = LoggerFactory.getLogger(FlowInterpreter.class);

    public static final float DEFAULT_MARGIN = 100.0f;
    static final float HALF_MARGIN = DEFAULT_MARGIN / 2;

    private final ColorFormat colorFormat;
    private final float hidpiScale;
    private final float[] codeColor;
    private final Anchorizer anchorizer;
    private final TextRunComposer composer;
    private final ListInterpreter lists;
    private final TableInterpreter tables;
    private final List<Diagnostic> diagnostics = Collections.synchronizedList(new ArrayList<>());

    public FlowInterpreter(MarkflowConfig config) {
        this(config, new Anchorizer());
    }

    public FlowInterpreter(MarkflowConfig config, Anchorizer anchorizer) {
        Theme theme = config.getTheme();
        this.colorFormat = config.getColorFormat();
        this.hidpiScale = config.getHidpiScale();
        this.codeColor = NativeColor.of(theme.getCodeColor(), colorFormat);
        this.anchorizer = anchorizer;
        this.composer = new TextRunComposer(
                NativeColor.of(theme.getTextColor(), colorFormat),
                NativeColor.of(theme.getLinkColor(), colorFormat),
                hidpiScale);
        this.lists = new ListInterpreter(this, composer);
        this.tables = new TableInterpreter(this, composer, hidpiScale);
    }

    public List<Element> interpret(Hir hir) {
        InheritedState state = initialState();
        Flow flow = new Flow(hidpiScale);
        processContent(hir, flow, state, hir.root().getContent());
        flow.pushTextBox(state);
        return flow.output();
    }

    /**
     * Interprets every top-level child of the root on its own and joins the
     * results in document order. Text sitting directly under the root is not
     * merged across children the way {@link #interpret(Hir)} merges it.
     */
    public List<Element> interpretParallel(Hir hir) {
        return hir.root().getContent().parallelStream()
                .map(item -> {
                    InheritedState state = initialState();
                    Flow flow = new Flow(hidpiScale);
                    processContent(hir, flow, state, List.of(item));
                    flow.pushTextBox(state);
                    return flow.output();
                })
                .flatMap(List::stream)
                .collect(Collectors.toList());
    }

    public List<Diagnostic> getDiagnostics() {
        synchronized (diagnostics) {
            return List.copyOf(diagnostics);
        }
    }

    private InheritedState initialState() {
        Span span = new Span(codeColor, FontWeight.NORMAL, FontStyle.NORMAL, TextDecoration.NONE);
        return new InheritedState(0.0f, TextOptions.DEFAULT, span);
    }

    void processContent(Hir hir, Flow flow, InheritedState state, List<HirContent> content) {
        for (HirContent item : content) {
            if (item instanceof HirContent.Text text) {
                composer.compose(flow.current(), state, text.text(), flow);
            } else if (item instanceof HirContent.Child child) {
                processNode(hir, flow, state, hir.node(child.index()));
            }
        }
    }

    private void processNode(Hir hir, Flow flow, InheritedState state, HirNode node) {
        List<HirContent> content = node.getContent();
        List<Attr> attributes = node.getAttributes();

        switch (node.getTag()) {
            case PARAGRAPH: {
                flow.pushTextBox(state);
                processContent(hir, flow, state.withAlign(Attr.findAlign(attributes)), content);
                flow.pushTextBox(state);
                flow.pushSpacer();
                break;
            }
            case DIV: {
                flow.pushTextBox(state);
                processContent(hir, flow, state.withAlign(Attr.findAlign(attributes)), content);
                flow.pushTextBox(state);
                break;
            }
            case BLOCK_QUOTE: {
                flow.pushTextBox(state);
                InheritedState quoted = state.withIndent(HALF_MARGIN)
                        .withOptions(TextOptions::withNestedBlockQuote);
                processContent(hir, flow, quoted, content);
                flow.pushTextBox(quoted);
                if (quoted.getGlobalIndent() == HALF_MARGIN) {
                    flow.pushSpacer();
                }
                break;
            }
            case H1:
            case H2:
            case H3:
            case H4:
            case H5:
            case H6:
                processHeader(hir, flow, state, node);
                break;
            case HORIZONTAL_RULER:
                flow.pushTextBox(state);
                flow.pushElement(Spacer.visible());
                break;
            case PREFORMATTED_TEXT:
                processPreformatted(hir, flow, state, node);
                break;
            case BREAK:
                flow.pushTextBox(state);
                break;
            case ANCHOR: {
                for (Attr attr : attributes) {
                    if (attr instanceof Attr.Href href) {
                        flow.setPendingLink(href.link());
                    } else if (attr instanceof Attr.Anchor anchor) {
                        flow.current().anchor = anchor.anchor();
                    }
                }
                processContent(hir, flow, state, content);
                break;
            }
            case BOLD_OR_STRONG:
                processContent(hir, flow, state.withOptions(TextOptions::withBold), content);
                break;
            case EMPHASIS_OR_ITALIC:
                processContent(hir, flow, state.withOptions(TextOptions::withItalic), content);
                break;
            case UNDERLINE:
                processContent(hir, flow, state.withOptions(TextOptions::withUnderline), content);
                break;
            case STRIKETHROUGH:
                processContent(hir, flow, state.withOptions(TextOptions::withStrikeThrough), content);
                break;
            case SMALL:
                processContent(hir, flow, state.withOptions(TextOptions::withSmall), content);
                break;
            case CODE:
                processContent(hir, flow, state.withOptions(TextOptions::withCode), content);
                break;
            case SPAN:
                processContent(hir, flow, state.withSpan(spanFromStyle(state.getSpan(), attributes)), content);
                break;
            case INPUT:
                processInput(flow, attributes);
                break;
            case ORDERED_LIST:
            case UNORDERED_LIST:
                lists.process(hir, flow, state, node);
                break;
            case TABLE:
                tables.process(hir, flow, state, node);
                break;
            case IMAGE:
            case PICTURE:
            case SOURCE:
                unsupported("Images (" + node.getTag() + ")");
                break;
            case DETAILS:
                unsupported("Collapsible sections (DETAILS)");
                break;
            case SECTION:
                unsupported("Sections (SECTION)");
                break;
            case SUMMARY:
                misplaced("SUMMARY can only be in a DETAILS element");
                break;
            case LIST_ITEM:
                misplaced("LIST_ITEM can only be in a list");
                break;
            case TABLE_HEAD:
            case TABLE_BODY:
            case TABLE_ROW:
            case TABLE_HEADER:
            case TABLE_DATA_CELL:
                misplaced(node.getTag() + " can only be in a TABLE");
                break;
            case ROOT:
                logger.error("Root element can't reach interpreter.");
                diagnostics.add(new Diagnostic(DiagnosticKind.MISPLACED_TAG, "Root element reached the interpreter"));
                break;
        }
    }

    private void processHeader(Hir hir, Flow flow, InheritedState state, HirNode node) {
        HeaderType header = node.getTag().getHeaderType();
        flow.pushTextBox(state);
        flow.pushSpacer();

        InheritedState headerState = state.withAlign(Attr.findAlign(node.getAttributes()))
                .withOptions(TextOptions::withBold);
        if (header == HeaderType.H1) {
            headerState = headerState.withOptions(TextOptions::withUnderline);
        }
        flow.current().fontSize *= header.getSizeMultiplier();

        processContent(hir, flow, headerState, node.getContent());

        String anchor = anchorizer.anchorize(flow.current().plainText());
        flow.current().anchor = "#" + anchor;
        flow.pushTextBox(headerState);
        flow.pushSpacer();
    }

    private void processPreformatted(Hir hir, Flow flow, InheritedState state, HirNode node) {
        flow.pushTextBox(state);
        String style = Attr.findStyle(node.getAttributes()).orElse("");
        for (Style declaration : StyleParser.parse(style)) {
            if (declaration instanceof Style.BackgroundColor background) {
                flow.current().backgroundColor = NativeColor.of(background.rgb(), colorFormat);
            }
        }
        flow.current().codeBlock = true;

        InheritedState preState = state.withOptions(TextOptions::withPreFormatted);
        processContent(hir, flow, preState, node.getContent());

        flow.pushTextBox(preState);
        flow.pushSpacer();
    }

    private void processInput(Flow flow, List<Attr> attributes) {
        boolean isCheckbox = false;
        boolean isChecked = false;
        for (Attr attr : attributes) {
            if (attr instanceof Attr.IsCheckbox) {
                isCheckbox = true;
            } else if (attr instanceof Attr.IsChecked) {
                isChecked = true;
            }
        }
        if (isCheckbox && flow.hasPendingListItem()) {
            flow.setPendingCheckbox(isChecked);
        } else if (isCheckbox) {
            flow.current().checkbox = isChecked;
        } else {
            unsupported("Inputs other than checkboxes");
        }
    }

    private Span spanFromStyle(Span span, List<Attr> attributes) {
        Span result = span;
        for (Style style : StyleParser.parse(Attr.findStyle(attributes).orElse(""))) {
            if (style instanceof Style.Color color) {
                result = result.withColor(NativeColor.of(color.rgb(), colorFormat));
            } else if (style instanceof Style.Weight weight) {
                result = result.withWeight(weight.weight());
            } else if (style instanceof Style.Slant slant) {
                result = result.withStyle(slant.style());
            } else if (style instanceof Style.Decoration decoration) {
                result = result.withDecoration(decoration.decoration());
            }
        }
        return result;
    }

    void unsupported(String feature) {
        logger.warn("Not supported, skipping: {}", feature);
        diagnostics.add(new Diagnostic(DiagnosticKind.UNSUPPORTED_FEATURE, feature));
    }

    void misplaced(String message) {
        logger.warn(message);
        diagnostics.add(new Diagnostic(DiagnosticKind.MISPLACED_TAG, message));
    }
}
