package gdreader.syntax.declarations;

import gdreader.syntax.Node;

/**
 * Anything that can stand on its own line in a class body.
 */
public abstract class ClassMember extends Node {
}
