package io.feydor.mmlbeep.mml;

/**
 * A command and the offset in the score of its first character
 */
public record PositionedCommand(MmlCommand command, int position) {}
