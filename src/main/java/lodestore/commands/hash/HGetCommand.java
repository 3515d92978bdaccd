package lodestore.commands.hash;

import lodestore.commands.Command;
import lodestore.commands.CommandSupport;
import lodestore.db.LodestoreDatabase;
import lodestore.protocol.RespValue;
import java.util.List;

public class HGetCommand implements Command {
    @Override
    public RespValue execute(LodestoreDatabase db, List<byte[]> args) {
        if (args.size() != 3) {
            return CommandSupport.wrongNumberOfArguments(args);
        }

        String key = CommandSupport.key(args.get(1));
        String field = CommandSupport.key(args.get(2));
        return RespValue.bulkString(db.getHashField(key, field));
    }
}
