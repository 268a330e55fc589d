package au.org.ala.imagedate.session;

import org.apache.commons.io.FileUtils;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.io.File;

import static org.junit.Assert.assertTrue;

@RunWith(JUnit4.class)
public class LocalImageDateEditorTest {

    @Test
    public void testDefaultFolderIsPicturesOrHome() {
        File folder = LocalImageDateEditor.defaultPicturesDir();
        File home = FileUtils.getUserDirectory();

        assertTrue(folder.isDirectory());
        assertTrue(folder.equals(home) || folder.equals(new File(home, "Pictures")));
    }
}
