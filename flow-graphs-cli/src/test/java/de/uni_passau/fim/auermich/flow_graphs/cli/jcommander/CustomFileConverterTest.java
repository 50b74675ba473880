package de.uni_passau.fim.auermich.flow_graphs.cli.jcommander;

import com.beust.jcommander.ParameterException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

public class CustomFileConverterTest {

    @TempDir
    File tempDir;

    @Test
    public void acceptsExistingFile() throws IOException {
        File file = new File(tempDir, "source.txt");
        assertTrue(file.createNewFile());

        assertEquals(file, new CustomFileConverter().convert(file.getPath()));
    }

    @Test
    public void rejectsDirectoryAndMissingFile() {
        CustomFileConverter converter = new CustomFileConverter();
        assertThrows(ParameterException.class, () -> converter.convert(tempDir.getPath()));
        assertThrows(ParameterException.class, () -> converter.convert(new File(tempDir, "missing").getPath()));
    }
}
