package io.drcontroller.executor;

/**
 * Builders for the ONTAP CLI commands issued by the controller.
 */
public final class OntapCommands {

    public static final String SNAPMIRROR_SHOW_FIELDS = "lag-time,state,status,schedule,policy,last-transfer-end-timestamp";
    public static final String NO_ENTRIES = "There are no entries matching your query.";

    private OntapCommands() {
        // Utility class - prevent instantiation
    }

    public static String snapmirrorShow(String destinationPath) {
        return "snapmirror show -destination-path " + destinationPath + " -fields " + SNAPMIRROR_SHOW_FIELDS;
    }

    public static String snapmirrorUpdate(String destinationPath) {
        return "snapmirror update -destination-path " + destinationPath;
    }

    public static String snapmirrorQuiesce(String destinationPath) {
        return "snapmirror quiesce -destination-path " + destinationPath;
    }

    public static String snapmirrorBreak(String destinationPath) {
        return "snapmirror break -destination-path " + destinationPath;
    }

    public static String snapmirrorResync(String destinationPath) {
        return "snapmirror resync -destination-path " + destinationPath;
    }

    public static String snapmirrorCreate(String sourcePath, String destinationPath, String policy, String schedule) {
        return "snapmirror create -source-path " + sourcePath + " -destination-path " + destinationPath
            + " -policy " + policy + " -schedule " + schedule;
    }

    public static String snapmirrorDelete(String destinationPath) {
        return "snapmirror delete -destination-path " + destinationPath;
    }

    public static String volumeOnline(String vserver, String volume) {
        return "volume online -vserver " + vserver + " -volume " + volume;
    }

    public static String volumeOffline(String vserver, String volume) {
        return "volume offline -vserver " + vserver + " -volume " + volume;
    }

    public static String volumeMount(String vserver, String volume) {
        return "volume mount -vserver " + vserver + " -volume " + volume + " -junction-path /" + volume;
    }

    public static String volumeUnmount(String vserver, String volume) {
        return "volume unmount -vserver " + vserver + " -volume " + volume;
    }

    public static String cifsShareShow(String vserver, String shareName) {
        return "cifs share show -vserver " + vserver + " -share-name " + shareName;
    }

    public static String cifsShareCreate(String vserver, String shareName, String path) {
        return "cifs share create -vserver " + vserver + " -share-name " + shareName + " -path " + path;
    }

    public static String cifsShareDelete(String vserver, String shareName) {
        return "cifs share delete -vserver " + vserver + " -share-name " + shareName;
    }
}
