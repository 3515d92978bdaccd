package lodestore.commands.hash;

import lodestore.commands.Command;
import lodestore.commands.CommandSupport;
import lodestore.db.LodestoreDatabase;
import lodestore.protocol.RespValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class HGetAllCommand implements Command {
    @Override
    public RespValue execute(LodestoreDatabase db, List<byte[]> args) {
        if (args.size() != 2) {
            return CommandSupport.wrongNumberOfArguments(args);
        }

        Map<String, byte[]> hash = db.getAllHashFields(CommandSupport.key(args.get(1)));
        if (hash == null) {
            return RespValue.nullBulkString();
        }

        List<RespValue> flat = new ArrayList<>(hash.size() * 2);
        for (Map.Entry<String, byte[]> e : hash.entrySet()) {
            flat.add(RespValue.bulkString(CommandSupport.keyBytes(e.getKey())));
            flat.add(RespValue.bulkString(e.getValue()));
        }
        return RespValue.array(flat);
    }
}
