package org.dxworks.flowframe.analyzer;

import org.dxworks.flowframe.model.SourceLocation;
import org.treesitter.TSNode;
import org.treesitter.TSPoint;
import org.treesitter.TSTree;

import java.nio.charset.StandardCharsets;

/**
 * A parsed file: the syntax tree plus the text it was built from.
 * Tree-sitter reports byte offsets and byte columns; this class converts them to text and character columns.
 */
public class ParsedSource {

    private final String filePath;
    private final String sourceCode;
    private final byte[] bytes;
    private final boolean singleByte;
    // keeps the native tree alive while nodes are in use
    private final TSTree tree;
    private final TSNode root;

    ParsedSource(String filePath, String sourceCode, TSTree tree) {
        this.filePath = filePath;
        this.sourceCode = sourceCode;
        this.bytes = sourceCode.getBytes(StandardCharsets.UTF_8);
        this.singleByte = bytes.length == sourceCode.length();
        this.tree = tree;
        this.root = tree.getRootNode();
    }

    public String getFilePath() {
        return filePath;
    }

    /**
     * Last path segment of the file path.
     */
    public String getFileName() {
        int slash = Math.max(filePath.lastIndexOf('/'), filePath.lastIndexOf('\\'));
        return slash >= 0 ? filePath.substring(slash + 1) : filePath;
    }

    public String getSourceCode() {
        return sourceCode;
    }

    public TSNode getRoot() {
        return root;
    }

    /**
     * Source text of a node with line endings normalised to {@code \n}.
     */
    public String text(TSNode node) {
        if (!TreeSitterHelper.isPresent(node)) return "";
        int start = Math.max(0, node.getStartByte());
        int end = Math.min(bytes.length, node.getEndByte());
        if (end <= start) return "";
        return new String(bytes, start, end - start, StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    /**
     * Character offset into the source text for a byte offset.
     */
    public int charOffset(int byteOffset) {
        int clamped = Math.max(0, Math.min(bytes.length, byteOffset));
        if (singleByte) return clamped;
        return new String(bytes, 0, clamped, StandardCharsets.UTF_8).length();
    }

    public SourceLocation location(TSNode node) {
        TSPoint start = node.getStartPoint();
        TSPoint end = node.getEndPoint();
        return new SourceLocation(
                filePath,
                start.getRow() + 1,
                charColumn(node.getStartByte(), start.getColumn()),
                end.getRow() + 1,
                charColumn(node.getEndByte(), end.getColumn()));
    }

    private int charColumn(int byteOffset, int byteColumn) {
        if (singleByte) return byteColumn;
        int lineStart = Math.max(0, byteOffset - byteColumn);
        return new String(bytes, lineStart, byteOffset - lineStart, StandardCharsets.UTF_8).length();
    }
}
