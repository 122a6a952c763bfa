package work.lcod.envbase.cli;

import picocli.CommandLine;

final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        return new String[] { "envbase " + (implementationVersion != null ? implementationVersion : "development") };
    }
}
