package org.emotion.io;

/** File name helpers shared by readers. */
public final class FileNames {

    private FileNames() {
    }

    /**
     * Last path component without its final extension; works for '/' and '\' separators.
     * Leading-dot names keep their dot.
     */
    public static String stem(String path) {
        String base = path.replace('\\', '/');
        base = base.substring(base.lastIndexOf('/') + 1);
        int dot = base.lastIndexOf('.');
        return dot > 0 ? base.substring(0, dot) : base;
    }
}
