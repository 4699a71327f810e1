package gdreader.syntax.statements;

import gdreader.syntax.Node;

public abstract class Statement extends Node {
}
