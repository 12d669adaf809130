package org.dxworks.clippy.model.block;

public interface BlockVisitor<R> {
    R visitParagraph(ParagraphBlock block);

    R visitHeading(HeadingBlock block);

    R visitList(ListBlock block);

    R visitQuote(QuoteBlock block);

    R visitCode(CodeBlock block);

    R visitDivider(DividerBlock block);
}
