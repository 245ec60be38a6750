package work.lcod.lgx.cli;

import picocli.CommandLine;
import work.lcod.lgx.api.LgxLibrary;

final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        return new String[] { "lgx (java) " + LgxLibrary.version() };
    }
}
