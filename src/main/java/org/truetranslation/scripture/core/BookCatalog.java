package org.truetranslation.scripture.core;

import org.truetranslation.scripture.core.model.BookRecord;

import java.util.List;

/**
 * Source of the books of one Bible version, in canonical order.
 */
public interface BookCatalog {

    List<BookRecord> listBooks();
}
