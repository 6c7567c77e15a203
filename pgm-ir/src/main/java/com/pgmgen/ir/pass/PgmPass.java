package com.pgmgen.ir.pass;

import com.pgmgen.ir.pgm.PgmDocument;

/**
 * PGM 文档 pass 接口。
 */
public interface PgmPass {

    /**
     * Pass 名称（用于日志/调试）。
     */
    String getName();

    /**
     * 处理文档，返回处理后的文档（可以是同一个实例）。
     */
    PgmDocument run(PgmDocument document);
}
