package org.dxworks.clippy.model.inline;

public record LineBreak() implements InlineContent {

    public static final LineBreak INSTANCE = new LineBreak();

    @Override
    public <R> R accept(InlineVisitor<R> visitor) {
        return visitor.visitLineBreak(this);
    }
}
