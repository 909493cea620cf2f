package com.eyelevel.tdocpipeline.service.render;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Converts rendered HTML into GitHub-flavoured Markdown. Handles headings, paragraphs, nested
 * lists, tables, preformatted blocks, block quotes and the common inline elements; unknown
 * elements contribute their text only.
 */
@Component
public class HtmlMarkdownConverter {

    private static final Set<String> BLOCK_CONTAINERS = Set.of(
            "div", "section", "article", "main", "header", "footer", "nav", "aside", "figure", "body",
            "dl", "address", "center");

    private static final Set<String> BLOCK_ELEMENTS = Set.of(
            "h1", "h2", "h3", "h4", "h5", "h6", "p", "ul", "ol", "table", "pre", "blockquote", "hr");

    public String convert(Document document) {
        Element root = document.body() != null ? document.body() : document;
        StringBuilder out = new StringBuilder();
        appendBlocks(root, out);
        String markdown = out.toString().replaceAll("\n{3,}", "\n\n").strip();
        return markdown.isEmpty() ? "" : markdown + "\n";
    }

    private void appendBlocks(Element container, StringBuilder out) {
        StringBuilder inline = new StringBuilder();
        for (Node child : container.childNodes()) {
            if (child instanceof Element element && isBlock(element)) {
                flushParagraph(inline, out);
                appendBlock(element, out);
            } else {
                inline.append(inline(child));
            }
        }
        flushParagraph(inline, out);
    }

    private boolean isBlock(Element element) {
        String tag = element.normalName();
        return BLOCK_ELEMENTS.contains(tag) || BLOCK_CONTAINERS.contains(tag);
    }

    private void appendBlock(Element element, StringBuilder out) {
        String tag = element.normalName();
        switch (tag) {
            case "h1", "h2", "h3", "h4", "h5", "h6" -> {
                String text = collapse(inlineChildren(element));
                if (!text.isEmpty()) {
                    int level = tag.charAt(1) - '0';
                    out.append("#".repeat(level)).append(' ').append(text).append("\n\n");
                }
            }
            case "p" -> {
                StringBuilder paragraph = new StringBuilder(inlineChildren(element));
                flushParagraph(paragraph, out);
            }
            case "ul", "ol" -> {
                appendList(element, 0, out);
                out.append('\n');
            }
            case "table" -> appendTable(element, out);
            case "pre" -> appendPreformatted(element, out);
            case "blockquote" -> appendBlockquote(element, out);
            case "hr" -> out.append("---\n\n");
            default -> appendBlocks(element, out);
        }
    }

    private void flushParagraph(StringBuilder inline, StringBuilder out) {
        String text = collapse(inline.toString());
        if (!text.isEmpty()) {
            out.append(text).append("\n\n");
        }
        inline.setLength(0);
    }

    private void appendList(Element list, int depth, StringBuilder out) {
        boolean ordered = "ol".equals(list.normalName());
        int index = ordered ? parseStart(list) : 0;
        for (Element item : list.children()) {
            if (!"li".equals(item.normalName())) {
                continue;
            }
            StringBuilder text = new StringBuilder();
            List<Element> nested = new ArrayList<>();
            for (Node child : item.childNodes()) {
                if (child instanceof Element element && ("ul".equals(element.normalName()) || "ol".equals(element.normalName()))) {
                    nested.add(element);
                } else {
                    text.append(inline(child)).append(isParagraph(child) ? " " : "");
                }
            }
            String marker = ordered ? (index++) + ". " : "- ";
            out.append("  ".repeat(depth)).append(marker).append(collapse(text.toString()).replace("\n", " ")).append('\n');
            for (Element sublist : nested) {
                appendList(sublist, depth + 1, out);
            }
        }
    }

    private boolean isParagraph(Node node) {
        return node instanceof Element element && "p".equals(element.normalName());
    }

    private int parseStart(Element list) {
        try {
            return list.hasAttr("start") ? Integer.parseInt(list.attr("start").trim()) : 1;
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    private void appendTable(Element table, StringBuilder out) {
        List<List<String>> rows = new ArrayList<>();
        int columns = 0;
        for (Element row : table.select("tr")) {
            List<String> cells = new ArrayList<>();
            for (Element cell : row.children()) {
                if ("td".equals(cell.normalName()) || "th".equals(cell.normalName())) {
                    cells.add(tableCell(cell));
                }
            }
            if (!cells.isEmpty()) {
                rows.add(cells);
                columns = Math.max(columns, cells.size());
            }
        }
        if (rows.isEmpty()) {
            return;
        }
        appendRow(rows.get(0), columns, out);
        out.append('|');
        for (int i = 0; i < columns; i++) {
            out.append(" --- |");
        }
        out.append('\n');
        for (List<String> row : rows.subList(1, rows.size())) {
            appendRow(row, columns, out);
        }
        out.append('\n');
    }

    private String tableCell(Element cell) {
        return collapse(inlineChildren(cell)).replace("\n", " ").replace("|", "\\|");
    }

    private void appendRow(List<String> cells, int columns, StringBuilder out) {
        out.append('|');
        for (int i = 0; i < columns; i++) {
            String cell = i < cells.size() ? cells.get(i) : "";
            out.append(' ').append(cell).append(cell.isEmpty() ? "|" : " |");
        }
        out.append('\n');
    }

    private void appendPreformatted(Element pre, StringBuilder out) {
        String code = pre.wholeText();
        while (code.endsWith("\n")) {
            code = code.substring(0, code.length() - 1);
        }
        out.append("```\n").append(code).append("\n```\n\n");
    }

    private void appendBlockquote(Element quote, StringBuilder out) {
        StringBuilder inner = new StringBuilder();
        appendBlocks(quote, inner);
        String body = inner.toString().strip();
        if (body.isEmpty()) {
            return;
        }
        for (String line : body.split("\n", -1)) {
            out.append(line.isEmpty() ? ">" : "> " + line).append('\n');
        }
        out.append('\n');
    }

    private String inline(Node node) {
        if (node instanceof TextNode textNode) {
            return textNode.getWholeText().replaceAll("\\s+", " ");
        }
        if (!(node instanceof Element element)) {
            return "";
        }
        switch (element.normalName()) {
            case "br":
                return "\n";
            case "strong", "b":
                return wrap(inlineChildren(element), "**");
            case "em", "i":
                return wrap(inlineChildren(element), "*");
            case "code":
                return wrap(element.text(), "`");
            case "a": {
                String text = inlineChildren(element).strip();
                String href = element.attr("href").trim();
                if (href.isEmpty() || text.isEmpty()) {
                    return text;
                }
                return "[" + text + "](" + href + ")";
            }
            case "img": {
                String src = element.attr("src").trim();
                return src.isEmpty() ? "" : "![" + element.attr("alt").trim() + "](" + src + ")";
            }
            case "script", "style", "head":
                return "";
            default:
                return inlineChildren(element);
        }
    }

    private String inlineChildren(Element element) {
        StringBuilder text = new StringBuilder();
        for (Node child : element.childNodes()) {
            text.append(inline(child));
            if (child instanceof Element nested && isBlock(nested)) {
                text.append(' ');
            }
        }
        return text.toString();
    }

    private String wrap(String text, String marker) {
        String trimmed = text.strip();
        return trimmed.isEmpty() ? "" : marker + trimmed + marker;
    }

    /**
     * Collapses runs of spaces and trims every line.
     */
    private String collapse(String text) {
        StringBuilder result = new StringBuilder();
        for (String line : text.split("\n", -1)) {
            String normalized = line.replaceAll("[ \\t\\u00A0]+", " ").strip();
            if (!normalized.isEmpty()) {
                if (result.length() > 0) {
                    result.append('\n');
                }
                result.append(normalized);
            }
        }
        return result.toString();
    }
}
