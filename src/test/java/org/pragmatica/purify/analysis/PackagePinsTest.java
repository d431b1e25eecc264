package org.pragmatica.purify.analysis;

import org.pragmatica.purify.analysis.PackagePins.UnpinnedPackage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PackagePinsTest {

    private static List<String> names(String commandText) {
        return PackagePins.unpinned(commandText).stream().map(UnpinnedPackage::name).toList();
    }

    @Test
    void unpinned_aptPackages_skipsOptionsAndPinned() {
        var packages = PackagePins.unpinned("apt-get install -y --no-install-recommends curl git=1:2.39.2-1");

        assertEquals(List.of(new UnpinnedPackage("apt", "curl")), packages);
    }

    @Test
    void unpinned_stopsAtCommandSeparator() {
        assertEquals(List.of("curl"), names("apk add curl && rm -rf /var/cache/apk/*"));
    }

    @Test
    void unpinned_managerSpecificPinSyntax() {
        assertEquals(List.of("requests"), names("pip install flask==3.0.0 requests"));
        assertEquals(List.of("lodash"), names("npm install left-pad@1.3.0 lodash"));
    }

    @Test
    void unpinned_requirementsFilesAndVariables_ignored() {
        assertTrue(PackagePins.unpinned("pip install -r requirements.txt").isEmpty());
        assertTrue(PackagePins.unpinned("apt-get install -y $PACKAGES").isEmpty());
        assertTrue(PackagePins.unpinned("echo apt-get").isEmpty());
    }

    @Test
    void unpinned_severalInstallsInOneLine() {
        var packages = PackagePins.unpinned("apt-get install -y make; pip3 install build");

        assertEquals(List.of("apt", "pip"), packages.stream().map(UnpinnedPackage::manager).toList());
    }

    @Test
    void suggestion_followsManagerSyntax() {
        assertEquals("curl=<version>", new UnpinnedPackage("apt", "curl").suggestion());
        assertEquals("flask==<version>", new UnpinnedPackage("pip", "flask").suggestion());
        assertEquals("lodash@<version>", new UnpinnedPackage("npm", "lodash").suggestion());
    }
}
