package au.org.ala.imagedate.session;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;

import java.io.File;
import java.util.Arrays;

public class LocalImageDateEditor {

    public static void main(String[] args) {
        File folder = args.length > 0 ? new File(args[0]) : defaultPicturesDir();
        if (!folder.isDirectory()) {
            error(String.format("Invalid folder: %s", folder));
        }

        ImageDateSession session = new ImageDateSession(folder);
        if (session.isEmpty()) {
            System.out.printf("No images found in %s%n", folder);
            return;
        }

        if (args.length == 1 || args.length == 0) {
            walk(session);
        } else if (args.length >= 3) {
            setDate(session, args[1], StringUtils.join(Arrays.copyOfRange(args, 2, args.length), ' '));
        } else {
            usage();
            System.exit(0);
        }
    }

    private static void walk(ImageDateSession session) {
        do {
            System.out.println(session.loadCurrent().getStatusLine());
        } while (session.next());
        System.out.println("Complete...");
    }

    private static void setDate(ImageDateSession session, String filename, String dateText) {
        if (!session.select(filename)) {
            error(String.format("No image named %s in %s", filename, session.getFolder()));
        }
        DateUpdateOutcome outcome = session.setDate(dateText);
        if (outcome.isSuccess()) {
            System.out.println(outcome.getMessage());
        } else {
            error(outcome.getMessage());
        }
    }

    /**
     * ~/Pictures if it exists, otherwise the home directory.
     */
    static File defaultPicturesDir() {
        File home = FileUtils.getUserDirectory();
        File pictures = new File(home, "Pictures");
        return pictures.isDirectory() ? pictures : home;
    }

    private static void usage() {
        System.out.println("LocalImageDateEditor [<folder>] | <folder> <filename> <date text...>");
    }

    private static void error(String message) {
        System.err.println(message);
        System.exit(-1);
    }
}
