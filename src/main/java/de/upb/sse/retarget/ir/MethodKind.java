package de.upb.sse.retarget.ir;

public enum MethodKind { NORMAL, INLINE, DYNAMIC, MACRO }
