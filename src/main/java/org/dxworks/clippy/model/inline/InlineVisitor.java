package org.dxworks.clippy.model.inline;

public interface InlineVisitor<R> {
    R visitText(TextSpan span);

    R visitLink(LinkSpan span);

    R visitLineBreak(LineBreak lineBreak);
}
