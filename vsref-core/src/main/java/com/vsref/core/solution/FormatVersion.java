package com.vsref.core.solution;

/**
 * Solution file format versions, as written in the solution file header.
 *
 * <p>Only the major component is significant. Visual Studio 2012 and every later
 * release write format version 12.
 */
public final class FormatVersion {

    /** Reported before a solution file has been loaded successfully. */
    public static final int UNDEFINED = 0;

    public static final int VISUAL_STUDIO_2002 = 7;
    public static final int VISUAL_STUDIO_2003 = 8;
    public static final int VISUAL_STUDIO_2005 = 9;
    public static final int VISUAL_STUDIO_2008 = 10;
    public static final int VISUAL_STUDIO_2010 = 11;
    public static final int VISUAL_STUDIO_2012 = 12;

    /** Oldest format version with a solution file header. */
    public static final int MINIMUM = VISUAL_STUDIO_2002;

    private FormatVersion() {
        // Prevent instantiation
    }
}
