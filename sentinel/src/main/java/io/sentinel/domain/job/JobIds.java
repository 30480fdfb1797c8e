package io.sentinel.domain.job;

/**
 * Job id helpers. Job types already contain a colon ({@code "ml:retrain"}),
 * so parameterized ids are {@code "ml:retrain:AAPL.US"}.
 */
public final class JobIds {

    public static final char SEPARATOR = ':';

    /**
     * Id of a parameterized job instance.
     */
    public static String of(String jobType, String parameterValue) {
        return jobType + SEPARATOR + parameterValue;
    }

    /**
     * True if {@code jobId} is an instance id of {@code jobType}.
     */
    public static boolean isInstanceOf(String jobId, String jobType) {
        return jobId.length() > jobType.length() + 1
            && jobId.startsWith(jobType)
            && jobId.charAt(jobType.length()) == SEPARATOR;
    }

    private JobIds() {}
}
