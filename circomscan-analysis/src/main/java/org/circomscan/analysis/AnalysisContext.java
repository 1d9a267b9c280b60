package org.circomscan.analysis;

import org.circomscan.structure.cfg.Cfg;
import org.circomscan.structure.file.FileLocation;

/*
What an analysis pass may ask about the program it is part of.

template() and function() lower the definition on first access. The CFG returned must be treated as read-only,
and must not be kept beyond the call that obtained it: a later lowering may replace it.
All methods except isTemplate() and isFunction() throw AnalysisException.
 */
public interface AnalysisContext {

    // does not trigger lowering
    boolean isTemplate(String name);

    // does not trigger lowering
    boolean isFunction(String name);

    Cfg template(String name);

    Cfg function(String name);

    /*
    the exact source text of the byte range in the given file
     */
    String underlyingStr(int fileId, FileLocation location);
}
