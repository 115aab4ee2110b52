package de.upb.sse.retarget.ir;

public enum DeclarationKind { CLASS, ENUM, TYPEDEF, ABSTRACT }
