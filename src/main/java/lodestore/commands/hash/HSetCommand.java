package lodestore.commands.hash;

import lodestore.commands.Command;
import lodestore.commands.CommandSupport;
import lodestore.db.LodestoreDatabase;
import lodestore.protocol.RespValue;
import java.util.List;

public class HSetCommand implements Command {
    @Override
    public RespValue execute(LodestoreDatabase db, List<byte[]> args) {
        // Single field/value pair only: HSET key field value
        if (args.size() != 4) {
            return CommandSupport.wrongNumberOfArguments(args);
        }

        db.setHashField(CommandSupport.key(args.get(1)), CommandSupport.key(args.get(2)), args.get(3));
        return RespValue.ok();
    }
}
