package sequencer.fixtures.scan.broken;

import sequencer.annotations.MigrationUnit;

@MigrationUnit(id = "not-a-migration")
public class NotAMigration {
}
