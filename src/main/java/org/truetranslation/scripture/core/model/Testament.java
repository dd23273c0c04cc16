package org.truetranslation.scripture.core.model;

public enum Testament {
    OT,
    NT
}
