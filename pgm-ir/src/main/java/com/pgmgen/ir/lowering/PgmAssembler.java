package com.pgmgen.ir.lowering;

import com.pgmgen.ir.pgm.PgmDocument;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * 把顶层片段组装为 PGM 文档
 */
public class PgmAssembler {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private final Clock clock;

    public PgmAssembler(Clock clock) {
        this.clock = clock;
    }

    public PgmAssembler() {
        this(Clock.systemDefaultZone());
    }

    public PgmDocument assemble(Fragment fragment, String start, String documentName) {
        String dateCreated = LocalDate.now(clock).format(DATE_FORMAT);
        return new PgmDocument(start == null ? "" : start, documentName, dateCreated,
                fragment.getFunctions(), fragment.getBody());
    }
}
