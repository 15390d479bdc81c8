package org.pragmatica.litedoc.tree;

public enum ListKind {
    ORDERED,
    UNORDERED
}
