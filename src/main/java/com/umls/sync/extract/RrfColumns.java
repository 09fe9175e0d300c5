package com.umls.sync.extract;

/**
 * Column positions of the RRF files. Every RRF row ends with a trailing {@code |},
 * so a split that keeps trailing empty fields yields one more field than there are columns.
 */
public final class RrfColumns {

    public static final String DELIMITER = "|";

    private RrfColumns() {
        // constants
    }

    /** MRCONSO.RRF, concept names and sources. */
    public static final class Conso {
        public static final int CUI = 0;
        public static final int LAT = 1;
        public static final int TS = 2;
        public static final int STT = 4;
        public static final int ISPREF = 6;
        public static final int SAB = 11;
        public static final int TTY = 12;
        public static final int CODE = 13;
        public static final int STR = 14;
        public static final int SUPPRESS = 16;
        public static final int WIDTH = 19;

        private Conso() {
        }
    }

    /** MRREL.RRF, related concepts. */
    public static final class Rel {
        public static final int CUI1 = 0;
        public static final int REL = 3;
        public static final int CUI2 = 4;
        public static final int RELA = 7;
        public static final int SAB = 10;
        public static final int WIDTH = 17;

        private Rel() {
        }
    }

    /** MRSTY.RRF, semantic types. */
    public static final class Sty {
        public static final int CUI = 0;
        public static final int TUI = 1;
        public static final int STY = 3;
        public static final int WIDTH = 7;

        private Sty() {
        }
    }

    /** DELETEDCUI.RRF, {@code PCUI|PSTR|}. */
    public static final class Deleted {
        public static final int CUI = 0;

        private Deleted() {
        }
    }

    /** MERGEDCUI.RRF, {@code PCUI1|CUI2|}. */
    public static final class Merged {
        public static final int OLD_CUI = 0;
        public static final int NEW_CUI = 1;

        private Merged() {
        }
    }
}
