package de.upb.sse.retarget.ir;

/** How a variable member is read or written. */
public enum VarAccess { NORMAL, ACCESSOR, DISALLOWED }
