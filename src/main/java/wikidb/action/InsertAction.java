package wikidb.action;

public class InsertAction extends OrmAction {
    public InsertAction(String sql, Object[] params) {
        super(sql, params);
    }

    @Override
    public int getFlushOrder() {
        return 0;
    }
}
