package oscar.provisioning.service.provisioning;

/**
 * Reserved label keys injected into every service.
 */
public final class ServiceLabels {

    public static final String SERVICE = "oscar_service";
    public static final String APPLICATION_ID = "applicationId";
    public static final String QUEUE = "queue";
    public static final String VO = "vo";

    public static final String ROOT_QUEUE = "root";

    private ServiceLabels() {
    }

    /** Name of the queue grouping the platform's services under the scheduler's root queue. */
    public static String platformQueue(String platformName) {
        return platformName + "-queue";
    }

    /** Fully qualified scheduler queue of a service: {@code root.<platform>-queue.<service>}. */
    public static String queuePath(String platformName, String serviceName) {
        return String.join(".", ROOT_QUEUE, platformQueue(platformName), serviceName);
    }
}
